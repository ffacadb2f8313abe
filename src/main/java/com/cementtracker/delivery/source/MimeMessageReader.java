package com.cementtracker.delivery.source;

import com.cementtracker.delivery.model.InboundMessage;
import jakarta.mail.Address;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.internet.InternetAddress;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Date;

/**
 * Converts a MIME message into an {@link InboundMessage}. Plain text parts are preferred; an
 * HTML-only body is flattened to text keeping one table row per line.
 */
public final class MimeMessageReader {
    private final ZoneId zone;

    public MimeMessageReader(ZoneId zone) {
        this.zone = zone == null ? ZoneId.systemDefault() : zone;
    }

    public InboundMessage read(Message message) throws MessagingException, IOException {
        String address = "";
        String display = "";
        Address[] from = message.getFrom();
        if (from != null && from.length > 0) {
            if (from[0] instanceof InternetAddress) {
                InternetAddress internet = (InternetAddress) from[0];
                address = safe(internet.getAddress());
                display = safe(internet.getPersonal());
            } else {
                display = safe(from[0].toString());
            }
        }
        return InboundMessage.builder()
                .senderAddress(address)
                .senderDisplayName(display)
                .subject(safe(message.getSubject()))
                .body(bodyText(message))
                .receivedAt(receivedAt(message))
                .build();
    }

    LocalDateTime receivedAt(Message message) throws MessagingException {
        Date when = message.getReceivedDate();
        if (when == null) {
            when = message.getSentDate();
        }
        return when == null ? null : LocalDateTime.ofInstant(when.toInstant(), zone);
    }

    static String bodyText(Part part) throws MessagingException, IOException {
        String plain = findPart(part, "text/plain");
        if (plain != null && !plain.isBlank()) {
            return plain;
        }
        String html = findPart(part, "text/html");
        return html == null ? "" : htmlToText(html);
    }

    private static String findPart(Part part, String mimeType) throws MessagingException, IOException {
        if (Part.ATTACHMENT.equalsIgnoreCase(part.getDisposition())) {
            return null;
        }
        if (part.isMimeType(mimeType)) {
            return contentAsString(part);
        }
        if (part.isMimeType("multipart/*")) {
            Multipart multipart = (Multipart) part.getContent();
            for (int i = 0; i < multipart.getCount(); i++) {
                String found = findPart(multipart.getBodyPart(i), mimeType);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    private static String contentAsString(Part part) throws MessagingException, IOException {
        Object content = part.getContent();
        if (content instanceof String) {
            return (String) content;
        }
        if (content instanceof InputStream) {
            try (InputStream in = (InputStream) content) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        }
        return content == null ? null : content.toString();
    }

    /**
     * Flattens an HTML body to text with one line per block or table row; cells stay space separated.
     */
    public static String htmlToText(String html) {
        Document doc = Jsoup.parse(html);
        doc.outputSettings().prettyPrint(false);
        doc.select("br").append("\\n");
        doc.select("p,div,tr,li,h1,h2,h3,h4,h5,h6,table").prepend("\\n");
        doc.select("td,th").append(" ");
        String text = doc.text().replace("\\n", "\n");
        return text.replaceAll("[ \\t\\x0B\\f]*\\n[ \\t\\x0B\\f]*", "\n").replaceAll("\\n{3,}", "\n\n").trim();
    }

    private static String safe(String value) {
        return value == null ? "" : value.trim();
    }
}
