package ae.teletronics.attachments;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AttachmentStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(AttachmentStoreApplication.class, args);
    }
}
