package com.cementtracker.delivery.source;

import com.cementtracker.core.SourceUnavailableException;
import com.cementtracker.delivery.config.Config;
import com.cementtracker.delivery.model.InboundMessage;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jakarta.mail.search.AndTerm;
import jakarta.mail.search.ComparisonTerm;
import jakarta.mail.search.ReceivedDateTerm;
import jakarta.mail.search.SearchTerm;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Date;
import java.util.List;
import java.util.Properties;

/**
 * Reads report mails from an IMAP folder opened read-only.
 */
public final class ImapMessageSource implements MessageSource {
    private static final Logger LOG = LogManager.getLogger(ImapMessageSource.class);

    public static final class Settings {
        public String host;
        public int port;
        public boolean ssl;
        public String user;
        public String pass;
        public String folder;
        public int timeoutMs;
        public ZoneId zone;
    }

    public static Settings loadSettings(Config config) {
        Settings settings = new Settings();
        settings.host = config.getString("imap.host", "");
        settings.ssl = config.getBoolean("imap.ssl", true);
        settings.port = config.getInt("imap.port", settings.ssl ? 993 : 143);
        settings.user = config.getString("imap.user", "");
        settings.pass = firstNonBlank(System.getenv("CEMENT_IMAP_PASS"), config.getString("imap.pass", ""));
        settings.folder = config.getString("imap.folder", "INBOX");
        settings.timeoutMs = config.getInt("imap.timeout_ms", 20000);
        settings.zone = resolveZone(config.getString("app.zone", ""));
        return settings;
    }

    private final Settings settings;
    private final MimeMessageReader reader;

    public ImapMessageSource(Settings settings) {
        this.settings = settings;
        this.reader = new MimeMessageReader(settings.zone);
    }

    @Override
    public List<InboundMessage> fetch(LocalDate from, LocalDate to) throws SourceUnavailableException {
        if (isBlank(settings.host) || isBlank(settings.user) || isBlank(settings.pass)) {
            throw new SourceUnavailableException("imap settings incomplete: host, user and pass are required");
        }
        String protocol = settings.ssl ? "imaps" : "imap";
        Session session = Session.getInstance(sessionProperties(protocol));
        Store store = null;
        Folder folder = null;
        try {
            store = session.getStore(protocol);
            store.connect(settings.host, settings.port, settings.user, settings.pass);
            folder = store.getFolder(settings.folder);
            folder.open(Folder.READ_ONLY);

            Message[] found = folder.search(windowTerm(from, to));
            List<InboundMessage> out = new ArrayList<>();
            for (Message message : found) {
                InboundMessage inbound = readOne(message);
                if (inbound != null && inWindow(inbound.receivedAt, from, to)) {
                    out.add(inbound);
                }
            }
            out.sort(Comparator.comparing(
                    (InboundMessage m) -> m.receivedAt, Comparator.nullsFirst(Comparator.<LocalDateTime>naturalOrder())).reversed());
            LOG.info("IMAP {}@{}/{}: {} message(s) in {}..{}",
                    settings.user, settings.host, settings.folder, out.size(), from, to);
            return out;
        } catch (MessagingException e) {
            throw new SourceUnavailableException("imap fetch failed: " + e.getMessage(), e);
        } finally {
            closeQuietly(folder, store);
        }
    }

    @Override
    public String describe() {
        return "imap://" + settings.user + "@" + settings.host + ":" + settings.port + "/" + settings.folder;
    }

    private InboundMessage readOne(Message message) {
        try {
            return reader.read(message);
        } catch (MessagingException | IOException e) {
            LOG.warn("Skipping unreadable message #{}: {}", message.getMessageNumber(), e.getMessage());
            return null;
        }
    }

    private Properties sessionProperties(String protocol) {
        Properties props = new Properties();
        props.put("mail.store.protocol", protocol);
        props.put("mail." + protocol + ".host", settings.host);
        props.put("mail." + protocol + ".port", String.valueOf(settings.port));
        props.put("mail." + protocol + ".connectiontimeout", String.valueOf(settings.timeoutMs));
        props.put("mail." + protocol + ".timeout", String.valueOf(settings.timeoutMs));
        if (settings.ssl) {
            props.put("mail.imaps.ssl.enable", "true");
        }
        return props;
    }

    private SearchTerm windowTerm(LocalDate from, LocalDate to) {
        // IMAP compares dates only, so the upper bound is the day after the window.
        Date start = toDate(from);
        Date end = toDate(to.plusDays(1));
        return new AndTerm(
                new ReceivedDateTerm(ComparisonTerm.GE, start),
                new ReceivedDateTerm(ComparisonTerm.LT, end));
    }

    private boolean inWindow(LocalDateTime receivedAt, LocalDate from, LocalDate to) {
        if (receivedAt == null) {
            return true;
        }
        LocalDate day = receivedAt.toLocalDate();
        return !day.isBefore(from) && !day.isAfter(to);
    }

    private Date toDate(LocalDate day) {
        return Date.from(day.atStartOfDay(settings.zone).toInstant());
    }

    private void closeQuietly(Folder folder, Store store) {
        try {
            if (folder != null && folder.isOpen()) {
                folder.close(false);
            }
        } catch (MessagingException e) {
            LOG.debug("Folder close failed: {}", e.getMessage());
        }
        try {
            if (store != null && store.isConnected()) {
                store.close();
            }
        } catch (MessagingException e) {
            LOG.debug("Store close failed: {}", e.getMessage());
        }
    }

    static ZoneId resolveZone(String raw) {
        if (isBlank(raw)) {
            return ZoneId.systemDefault();
        }
        return ZoneId.of(raw.trim());
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (!isBlank(value)) {
                return value.trim();
            }
        }
        return "";
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
