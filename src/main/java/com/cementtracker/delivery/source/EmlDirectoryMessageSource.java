package com.cementtracker.delivery.source;

import com.cementtracker.core.SourceUnavailableException;
import com.cementtracker.delivery.model.InboundMessage;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Replays saved {@code .eml} files from a directory. Files are read, never moved or changed.
 * Messages without any date are kept, since their window cannot be checked.
 */
public final class EmlDirectoryMessageSource implements MessageSource {
    private static final Logger LOG = LogManager.getLogger(EmlDirectoryMessageSource.class);

    private final Path directory;
    private final MimeMessageReader reader;
    private final Session session = Session.getInstance(new Properties());

    public EmlDirectoryMessageSource(Path directory, ZoneId zone) {
        this.directory = directory;
        this.reader = new MimeMessageReader(zone);
    }

    @Override
    public List<InboundMessage> fetch(LocalDate from, LocalDate to) throws SourceUnavailableException {
        if (!Files.isDirectory(directory)) {
            throw new SourceUnavailableException("eml directory not found: " + directory.toAbsolutePath());
        }
        List<Path> files;
        try (Stream<Path> stream = Files.list(directory)) {
            files = stream
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".eml"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new SourceUnavailableException("cannot list " + directory + ": " + e.getMessage(), e);
        }

        List<InboundMessage> out = new ArrayList<>();
        for (Path file : files) {
            InboundMessage message = readFile(file);
            if (message == null) {
                continue;
            }
            if (message.receivedAt != null) {
                LocalDate day = message.receivedAt.toLocalDate();
                if (day.isBefore(from) || day.isAfter(to)) {
                    continue;
                }
            }
            out.add(message);
        }
        LOG.info("EML {}: {} of {} file(s) in {}..{}", directory, out.size(), files.size(), from, to);
        return out;
    }

    @Override
    public String describe() {
        return "eml:" + directory.toAbsolutePath();
    }

    private InboundMessage readFile(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return reader.read(new MimeMessage(session, in));
        } catch (IOException | MessagingException e) {
            LOG.warn("Skipping unreadable file {}: {}", file.getFileName(), e.getMessage());
            return null;
        }
    }
}
