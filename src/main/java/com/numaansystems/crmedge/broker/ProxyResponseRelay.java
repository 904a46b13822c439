package com.numaansystems.crmedge.broker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Copies an upstream response onto the servlet response.
 *
 * <ul>
 *   <li>Binary bodies (PDF, images, ZIP, octet streams) are streamed byte for byte with
 *       their content type, length and disposition.</li>
 *   <li>Any other body is parsed as JSON and re-emitted as JSON. Bodies that are not
 *       JSON are passed through as text.</li>
 *   <li>Only pagination headers are forwarded.</li>
 * </ul>
 */
@Component
public class ProxyResponseRelay {

    private static final Logger logger = LoggerFactory.getLogger(ProxyResponseRelay.class);

    static final Set<String> PAGINATION_HEADERS = Set.of(
            "x-total-count",
            "x-page",
            "x-page-size",
            "x-total-pages",
            "x-next-cursor",
            "link"
    );

    private static final List<String> BINARY_TYPE_PREFIXES = List.of(
            "application/pdf",
            "image/",
            "application/zip",
            "application/octet-stream"
    );

    private final ObjectMapper objectMapper;

    public ProxyResponseRelay(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void relay(ClassicHttpResponse upstream, HttpServletResponse response) throws IOException {
        response.setStatus(upstream.getCode());
        copyPaginationHeaders(upstream, response);

        HttpEntity entity = upstream.getEntity();
        if (entity == null) {
            return;
        }

        String contentType = contentTypeOf(upstream, entity);
        if (isBinary(contentType)) {
            streamBinary(upstream, entity, contentType, response);
            return;
        }

        byte[] body = EntityUtils.toByteArray(entity);
        if (body.length == 0) {
            return;
        }
        try {
            JsonNode json = objectMapper.readTree(body);
            if (json == null || json.isMissingNode()) {
                writeRaw(body, contentType, response);
                return;
            }
            byte[] encoded = objectMapper.writeValueAsBytes(json);
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.setContentLength(encoded.length);
            response.getOutputStream().write(encoded);
        } catch (JsonProcessingException e) {
            logger.debug("Upstream body is not JSON ({}), relaying as text", e.getOriginalMessage());
            writeRaw(body, contentType, response);
        }
    }

    private static void writeRaw(byte[] body, String contentType, HttpServletResponse response) throws IOException {
        response.setContentType(contentType != null ? contentType : MediaType.TEXT_PLAIN_VALUE);
        response.setContentLength(body.length);
        response.getOutputStream().write(body);
    }

    static boolean isBinary(String contentType) {
        if (contentType == null) {
            return false;
        }
        String lower = contentType.toLowerCase(Locale.ROOT);
        for (String prefix : BINARY_TYPE_PREFIXES) {
            if (lower.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private void streamBinary(ClassicHttpResponse upstream, HttpEntity entity, String contentType,
                              HttpServletResponse response) throws IOException {
        response.setContentType(contentType);
        if (entity.getContentLength() >= 0) {
            response.setContentLengthLong(entity.getContentLength());
        }
        Header disposition = upstream.getFirstHeader(HttpHeaders.CONTENT_DISPOSITION);
        if (disposition != null) {
            response.setHeader(HttpHeaders.CONTENT_DISPOSITION, disposition.getValue());
        }
        try (InputStream in = entity.getContent()) {
            in.transferTo(response.getOutputStream());
        }
    }

    private static void copyPaginationHeaders(ClassicHttpResponse upstream, HttpServletResponse response) {
        for (Header header : upstream.getHeaders()) {
            if (PAGINATION_HEADERS.contains(header.getName().toLowerCase(Locale.ROOT))) {
                response.addHeader(header.getName(), header.getValue());
            }
        }
    }

    private static String contentTypeOf(ClassicHttpResponse upstream, HttpEntity entity) {
        Header header = upstream.getFirstHeader(HttpHeaders.CONTENT_TYPE);
        if (header != null) {
            return header.getValue();
        }
        return entity.getContentType();
    }
}
