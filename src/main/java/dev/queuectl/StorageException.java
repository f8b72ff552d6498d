package dev.queuectl;

import java.sql.SQLException;

public class StorageException extends QueueException {
    public StorageException(String message, SQLException cause) {
        super(message + ": " + cause.getMessage(), cause);
    }
}
