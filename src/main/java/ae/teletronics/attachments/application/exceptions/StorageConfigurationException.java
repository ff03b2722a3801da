package ae.teletronics.attachments.application.exceptions;

/**
 * Unknown storage key, missing backend or an unusable storage definition.
 */
public class StorageConfigurationException extends RuntimeException {

    public StorageConfigurationException(String message) {
        super(message);
    }

    public StorageConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
