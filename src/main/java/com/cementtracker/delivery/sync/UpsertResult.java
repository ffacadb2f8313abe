package com.cementtracker.delivery.sync;

import com.cementtracker.core.diagnostics.CauseCode;

import java.time.LocalDate;
import java.util.List;

/**
 * Result of writing one batch of records: how many rows were written and what happened to each date.
 */
public record UpsertResult(int insertedOrReplaced, List<Item> items) {

    public UpsertResult {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public int failedCount() {
        return items.size() - insertedOrReplaced;
    }

    /**
     * Write result for {@code date}, or null when that date was not part of the batch.
     */
    public Item itemFor(LocalDate date) {
        for (Item item : items) {
            if (item.date().equals(date)) {
                return item;
            }
        }
        return null;
    }

    /**
     * Per-date write result; {@code error} is empty for successful writes.
     */
    public record Item(LocalDate date, boolean ok, CauseCode cause, String error) {
        public Item {
            cause = cause == null ? CauseCode.NONE : cause;
            error = error == null ? "" : error;
        }

        static Item ok(LocalDate date) {
            return new Item(date, true, CauseCode.NONE, "");
        }

        static Item rejected(LocalDate date, String error) {
            return new Item(date, false, CauseCode.STORE_REJECTED, error);
        }
    }
}
