package org.endlesssource.mediarelay.agent.relay;

import org.endlesssource.mediarelay.protocol.message.ErrorCode;
import org.endlesssource.mediarelay.protocol.message.ErrorMessage;
import org.endlesssource.mediarelay.protocol.message.Message;
import org.endlesssource.mediarelay.protocol.message.Pong;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class OutboundQueueTest {

    @Test
    void messagesComeOutInOrder() throws Exception {
        OutboundQueue queue = new OutboundQueue(4);
        assertTrue(queue.offer(new Pong("1")));
        assertTrue(queue.offer(new Pong("2")));
        assertEquals(new Pong("1"), queue.take());
        assertEquals(new Pong("2"), queue.take());
        assertEquals(0, queue.size());
    }

    @Test
    void overflow_replacesBacklogWithSlowConsumerError() throws Exception {
        OutboundQueue queue = new OutboundQueue(2);
        assertTrue(queue.offer(new Pong("1")));
        assertTrue(queue.offer(new Pong("2")));

        assertFalse(queue.offer(new Pong("3")));

        assertTrue(queue.isOverflowed());
        assertTrue(queue.isFinished());
        Message next = queue.take();
        assertInstanceOf(ErrorMessage.class, next);
        assertEquals(ErrorCode.SLOW_CONSUMER, ((ErrorMessage) next).code());
        assertNull(queue.take());
        assertFalse(queue.offer(new Pong("4")));
    }

    @Test
    void finish_sendsPendingMessagesThenError() throws Exception {
        OutboundQueue queue = new OutboundQueue(1);
        queue.offer(new Pong("1"));

        assertTrue(queue.finish(new ErrorMessage(ErrorCode.SHUTTING_DOWN, null)));
        assertFalse(queue.finish(new ErrorMessage(ErrorCode.PROTOCOL_ERROR, null)));

        assertEquals(new Pong("1"), queue.take());
        assertEquals(ErrorCode.SHUTTING_DOWN, ((ErrorMessage) queue.take()).code());
        assertNull(queue.take());
        assertFalse(queue.isOverflowed());
    }

    @Test
    void take_waitsUntilMessageOrAbort() throws Exception {
        OutboundQueue queue = new OutboundQueue(4);
        CompletableFuture<Message> taken = CompletableFuture.supplyAsync(() -> {
            try {
                return queue.take();
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(50);
        assertFalse(taken.isDone());

        queue.abort();

        assertNull(taken.get(5, TimeUnit.SECONDS));
    }
}
