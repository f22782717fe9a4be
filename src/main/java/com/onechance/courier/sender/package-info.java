/**
 * Channel senders.
 *
 * <p>Each sender performs one delivery attempt for one recipient and reports failure as
 * {@link com.onechance.courier.sender.DeliveryException}.
 * <br>Email goes through SendGrid, SMS and MMS through Twilio.
 * <br>Disabled providers are replaced by {@link com.onechance.courier.sender.LoggingChannelSender}.
 */
package com.onechance.courier.sender;
