package ae.teletronics.attachments.domain.model;

/**
 * Where the current file of an attachment lives.
 */
public enum AttachmentStatus {
    /** Nothing attached. */
    EMPTY,
    /** Attached but only in cache storage; not yet promoted. */
    CACHED,
    /** In permanent storage. */
    STORED
}
