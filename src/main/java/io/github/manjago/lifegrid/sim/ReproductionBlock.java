package io.github.manjago.lifegrid.sim;

import org.jetbrains.annotations.Nullable;

/**
 * A blocked reproduction attempt, as reported to the stats collaborator.
 *
 * @param reason the gate that failed
 * @param detail extra text, e.g. the zone policy's reason
 * @param focalId organism that tried to reproduce
 * @param partnerId chosen partner, or -1 when none was found
 * @param tick tick of the attempt
 */
public record ReproductionBlock(BlockReason reason, @Nullable String detail, long focalId, long partnerId, long tick) {

    public String message() {
        return detail == null || detail.isBlank() ? reason.description() : reason.description() + ": " + detail;
    }
}
