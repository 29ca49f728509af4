/**
 * Bounded in-memory dead-letter store for querying, removing and replaying messages whose
 * delivery failed permanently.
 *
 * @see msgbus.dead.DeadLetterStore
 * @see msgbus.MessageBus#replayDeadLetter(int, String)
 */
package msgbus.dead;
