package ae.teletronics.attachments.application.metadata;

/** How an uploader settles the MIME type of an upload. */
public enum MimeTypeSource {
    /** Sniff the bytes. */
    CONTENT,
    /** Look the filename extension up. */
    EXTENSION,
    /** Trust the content type the client sent. */
    HEADER
}
