package fr.lapetina.ollama.minutes;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.ollama.minutes.extraction.ExtractionResult;
import fr.lapetina.ollama.minutes.extraction.ExtractionStatus;
import fr.lapetina.ollama.minutes.infrastructure.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command line entry point: extracts meeting minutes from a transcript file and prints them as JSON.
 *
 * <pre>
 * java -jar ollama-meeting-minutes.jar &lt;transcript-file&gt; [config.yaml]
 * </pre>
 */
public class MeetingMinutesApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MeetingMinutesApplication.class);

    private final MinutesExtractorFactory factory;
    private final ObjectMapper objectMapper;

    public MeetingMinutesApplication(String configPath) {
        log.info("Starting meeting minutes extractor...");
        this.factory = MinutesExtractorFactory.create(configPath).start();
        this.objectMapper = createObjectMapper();
    }

    static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        return mapper;
    }

    public ExtractionResult run(Path transcriptFile) throws IOException {
        String transcript = Files.readString(transcriptFile, StandardCharsets.UTF_8);
        log.info("Transcript loaded: file={}, length={}", transcriptFile, transcript.length());
        return factory.getService().extractMeetingMinutes(transcript);
    }

    public String toJson(ExtractionResult result) throws IOException {
        return objectMapper.writeValueAsString(result);
    }

    public MinutesExtractorFactory getFactory() {
        return factory;
    }

    @Override
    public void close() {
        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }
    }

    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("Usage: MeetingMinutesApplication <transcript-file> [config.yaml]");
            System.exit(2);
        }
        String configPath = args.length > 1 ? args[1] : ConfigLoader.DEFAULT_CONFIG;

        try (MeetingMinutesApplication app = new MeetingMinutesApplication(configPath)) {
            ExtractionResult result = app.run(Path.of(args[0]));
            System.out.println(app.toJson(result));
            log.info("Extraction finished: {}", result.summary());
            if (result.status() == ExtractionStatus.FAILED) {
                System.exit(1);
            }
        } catch (Exception e) {
            log.error("Meeting minutes extraction failed", e);
            System.exit(1);
        }
    }
}
