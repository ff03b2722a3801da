package ae.teletronics.attachments.application;

import java.io.IOException;

/**
 * Hooks a record layer calls around its own writes, in this order per save:
 * {@link #beforeSave()}, the record write, {@link #afterSave()}. {@link #afterDestroy()} follows a
 * successful delete of the record. The record layer owns the transaction boundaries.
 */
public interface AttachmentLifecycle {

    /** Promote cached files to permanent storage. */
    void beforeSave() throws IOException;

    /** The record write succeeded: delete replaced files. */
    void afterSave() throws IOException;

    /** The record is gone: delete its files. */
    void afterDestroy() throws IOException;
}
