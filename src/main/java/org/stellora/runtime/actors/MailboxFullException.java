package org.stellora.runtime.actors;

/**
 * Thrown when a message cannot be placed into a bounded mailbox within the send timeout.
 */
public class MailboxFullException extends RuntimeException {

    public MailboxFullException(String message) {
        super(message);
    }
}
