package com.shareledger.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Monotonic id arena for one entity type.
 *
 * {@code nextValue} is the next id to hand out. It is read and advanced inside the
 * transaction that inserts the record, so a rolled-back call never consumes an id.
 */
@Entity
@Table(name = "ledger_counters")
@Data
@NoArgsConstructor
public class LedgerCounter {

    @Id
    @Column(name = "counter_name")
    private String counterName;

    @Column(name = "next_value", nullable = false)
    private long nextValue;

    public LedgerCounter(String counterName) {
        this.counterName = counterName;
        this.nextValue = 1L;
    }

    /**
     * Hand out the current value and advance the arena.
     */
    public long allocate() {
        long allocated = nextValue;
        nextValue = Math.addExact(nextValue, 1L);
        return allocated;
    }
}
