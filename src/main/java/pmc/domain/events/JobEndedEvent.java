package pmc.domain.events;

import pmc.domain.jobs.TrackedJob;

/**
 * Posted on the event bus when a tracked job reaches a terminal status
 * @param job the ended job
 */
public record JobEndedEvent(TrackedJob job) {
}
