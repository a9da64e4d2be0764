package dev.pekelund.finsight.documents;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot application entry point for the document processing service.
 */
@SpringBootApplication(scanBasePackages = "dev.pekelund.finsight")
public class DocumentProcessorApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocumentProcessorApplication.class, args);
    }
}
