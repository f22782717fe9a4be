package com.onechance.courier.sender;

import com.onechance.courier.queue.payload.EmailPayload;
import com.onechance.courier.queue.payload.MmsPayload;
import com.onechance.courier.queue.payload.SmsPayload;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ChannelSendersTest {

    @Mock
    private ChannelSender<EmailPayload> email;

    @Mock
    private ChannelSender<SmsPayload> sms;

    @Mock
    private ChannelSender<MmsPayload> mms;

    private ChannelSenders senders;
    private AutoCloseable closeable;

    @BeforeEach
    void setUp() {
        closeable = MockitoAnnotations.openMocks(this);
        senders = new ChannelSenders(email, sms, mms);
    }

    @AfterEach
    void tearDown() throws Exception {
        closeable.close();
    }

    @Test
    void testRoutesEachPayloadToItsChannel() throws DeliveryException {
        EmailPayload emailPayload = new EmailPayload(List.of("guest@example.com"), "Photos", "See attached");
        SmsPayload smsPayload = new SmsPayload(List.of("+15551234567"), "Hi");
        MmsPayload mmsPayload = new MmsPayload(List.of("+15551234567"), "Look", List.of("https://cdn.example.com/1.jpg"));

        senders.send("guest@example.com", emailPayload);
        senders.send("+15551234567", smsPayload);
        senders.send("+15551234567", mmsPayload);

        verify(email).send("guest@example.com", emailPayload);
        verify(sms).send("+15551234567", smsPayload);
        verify(mms).send("+15551234567", mmsPayload);
        verifyNoMoreInteractions(email, sms, mms);
    }

    @Test
    void testDeliveryExceptionPropagates() throws DeliveryException {
        doThrow(new DeliveryException("Twilio error 21211: Invalid 'To' Phone Number"))
                .when(sms).send(anyString(), any());

        DeliveryException e = assertThrows(DeliveryException.class,
                () -> senders.send("+1", new SmsPayload(List.of("+1"), "Hi")));

        assertEquals("Twilio error 21211: Invalid 'To' Phone Number", e.getMessage());
        verifyNoInteractions(email, mms);
    }

    @Test
    void testRejectsMissingSender() {
        assertThrows(NullPointerException.class, () -> new ChannelSenders(email, null, mms));
    }
}
