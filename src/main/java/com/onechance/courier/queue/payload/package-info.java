/**
 * Channel specific message payloads.
 */
package com.onechance.courier.queue.payload;
