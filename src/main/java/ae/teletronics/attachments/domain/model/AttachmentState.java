package ae.teletronics.attachments.domain.model;

/**
 * Snapshot of one attachment field on one record instance.
 *
 * @param current  attached file, null when empty
 * @param previous last persisted file superseded by a pending change, deleted once that change is persisted
 * @param dirty    whether {@code current} changed since the last successful persistence
 */
public record AttachmentState(UploadedFile current, UploadedFile previous, boolean dirty) {

    public static AttachmentState empty() {
        return new AttachmentState(null, null, false);
    }

    public static AttachmentState persisted(UploadedFile current) {
        return new AttachmentState(current, null, false);
    }
}
