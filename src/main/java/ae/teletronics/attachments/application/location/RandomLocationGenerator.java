package ae.teletronics.attachments.application.location;

import ae.teletronics.attachments.application.util.TokenGenerator;
import ae.teletronics.attachments.domain.model.FileMetadata;

/** {@code <32 random chars>[.ext]} */
public class RandomLocationGenerator implements LocationGenerator {

    @Override
    public String generate(FileMetadata metadata, String extension) {
        return LocationGenerator.withExtension(TokenGenerator.randomToken(), extension);
    }
}
