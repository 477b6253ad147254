package com.mimecast.dispatch.smtp;

import com.mimecast.dispatch.smtp.connection.SmtpException;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a batch send, one item per email in input order.
 */
public class BatchSendResult {

    private final List<Item> items;
    private final Duration duration;

    /**
     * Constructs a new BatchSendResult instance.
     *
     * @param items    Items in input order.
     * @param duration Total elapsed time.
     */
    public BatchSendResult(List<Item> items, Duration duration) {
        this.items = List.copyOf(items);
        this.duration = duration;
    }

    public List<Item> getItems() {
        return items;
    }

    public int getTotal() {
        return items.size();
    }

    public int getSucceeded() {
        return (int) items.stream().filter(Item::success).count();
    }

    public int getFailed() {
        return getTotal() - getSucceeded();
    }

    public Duration getDuration() {
        return duration;
    }

    @Override
    public String toString() {
        return "BatchSendResult{total=" + getTotal() + ", succeeded=" + getSucceeded() +
                ", failed=" + getFailed() + ", duration=" + duration.toMillis() + "ms}";
    }

    /**
     * One batch entry.
     *
     * @param index   Position in the batch.
     * @param success Was the email delivered.
     * @param result  SendResult or null on failure.
     * @param error   Failure or null on success.
     */
    public record Item(int index, boolean success, SendResult result, SmtpException error) {

        public static Item success(int index, SendResult result) {
            return new Item(index, true, result, null);
        }

        public static Item failure(int index, SmtpException error) {
            return new Item(index, false, null, error);
        }
    }
}
