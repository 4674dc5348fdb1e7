package org.endlesssource.mediarelay.agent.relay;

import org.endlesssource.mediarelay.protocol.message.ErrorCode;
import org.endlesssource.mediarelay.protocol.message.ErrorMessage;
import org.endlesssource.mediarelay.protocol.message.Message;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Bounded queue between the producers of a relay session's messages and its writer thread.
 * <p>
 * Producers never block. When the queue is full the pending messages are dropped and replaced by a
 * single {@link ErrorCode#SLOW_CONSUMER} error; the queue then accepts nothing else.
 */
final class OutboundQueue {
    private final int capacity;
    private final Deque<Message> messages = new ArrayDeque<>();
    private boolean finished;
    private boolean overflowed;

    OutboundQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    /**
     * @return false when the message was dropped because the queue is finished or just overflowed
     */
    synchronized boolean offer(Message message) {
        if (finished) {
            return false;
        }
        if (messages.size() >= capacity) {
            messages.clear();
            messages.add(new ErrorMessage(ErrorCode.SLOW_CONSUMER,
                    "More than " + capacity + " messages waiting to be sent"));
            overflowed = true;
            finished = true;
            notifyAll();
            return false;
        }
        messages.add(message);
        notifyAll();
        return true;
    }

    /**
     * Queue a terminal error behind the pending messages, ignoring the capacity.
     *
     * @return false if the queue was already finished
     */
    synchronized boolean finish(ErrorMessage error) {
        if (finished) {
            return false;
        }
        messages.add(error);
        finished = true;
        notifyAll();
        return true;
    }

    /**
     * Drop everything; {@link #take()} returns null from now on.
     */
    synchronized void abort() {
        messages.clear();
        finished = true;
        notifyAll();
    }

    /**
     * Next message to send, waiting for one if needed.
     *
     * @return null once the queue is finished and drained
     */
    synchronized Message take() throws InterruptedException {
        while (messages.isEmpty()) {
            if (finished) {
                return null;
            }
            wait();
        }
        return messages.poll();
    }

    synchronized boolean isFinished() {
        return finished;
    }

    synchronized boolean isOverflowed() {
        return overflowed;
    }

    synchronized int size() {
        return messages.size();
    }
}
