package uk.gegc.revisionhelper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RevisionHelperApplication {

    public static void main(String[] args) {
        SpringApplication.run(RevisionHelperApplication.class, args);
    }
}
