package pmc.domain.device;

import pmc.common.PrinterConstants;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sequence ids for control channel payloads, 1..9999 then rolling over
 * @author Martin Sustik <sustik@herman.cz>
 * @since 11/10/2026
 */
public class ControlSequence {
    private final AtomicInteger counter = new AtomicInteger();

    public String next() {
        int value = counter.updateAndGet(current -> current >= PrinterConstants.MAX_SEQUENCE_ID ? 1 : current + 1);
        return String.valueOf(value);
    }
}
