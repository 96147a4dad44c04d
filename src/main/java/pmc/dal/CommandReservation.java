package pmc.dal;

/**
 * Persisted marker that a command id has been taken by this client
 * @param commandId cloud command id
 * @param status reservation state
 * @param timestamp epoch millis of the last state change
 */
public record CommandReservation(String commandId, ReservationStatus status, long timestamp) {
}
