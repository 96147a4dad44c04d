package pmc.dal;

import com.google.gson.annotations.SerializedName;

/**
 * State of a locally reserved command
 * @author Martin Sustik <sustik@herman.cz>
 * @since 09/10/2026
 */
public enum ReservationStatus {
    @SerializedName("reserved")
    RESERVED,
    @SerializedName("completed")
    COMPLETED,
    @SerializedName("failed")
    FAILED;

    public static ReservationStatus fromOutcome(boolean succeeded) {
        return succeeded ? COMPLETED : FAILED;
    }
}
