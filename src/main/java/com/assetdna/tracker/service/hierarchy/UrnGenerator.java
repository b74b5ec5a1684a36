package com.assetdna.tracker.service.hierarchy;

import com.assetdna.tracker.config.AssetDnaProperties;
import com.assetdna.tracker.model.AssetType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Derives stable, deterministic URNs for assets.
 *
 * Format: {prefix}:{typeCode}:{ancestor-1}/{ancestor-2}/.../{name}
 *
 * Every path segment is percent-encoded with only RFC 3986 unreserved characters left as-is, so a
 * '/' or ':' inside a name cannot be confused with a separator and two different ancestor paths
 * never produce the same URN. Case is preserved because sibling names are case-sensitive.
 */
@Component
@RequiredArgsConstructor
public class UrnGenerator {

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private final AssetDnaProperties properties;

    /**
     * @param ancestorNames names from the root down to the direct parent; empty for a root asset
     */
    public String generate(AssetType type, List<String> ancestorNames, String name) {
        String path = ancestorNames.stream()
                .map(this::encodeSegment)
                .collect(Collectors.joining("/"));
        String encodedName = encodeSegment(name);
        String fullPath = path.isEmpty() ? encodedName : path + "/" + encodedName;
        return String.format("%s:%s:%s", properties.getUrnPrefix(), type.getCode(), fullPath);
    }

    public String encodeSegment(String segment) {
        byte[] bytes = segment.getBytes(StandardCharsets.UTF_8);
        StringBuilder encoded = new StringBuilder(bytes.length);
        for (byte b : bytes) {
            int c = b & 0xFF;
            if (isUnreserved(c)) {
                encoded.append((char) c);
            } else {
                encoded.append('%').append(HEX[c >> 4]).append(HEX[c & 0x0F]);
            }
        }
        return encoded.toString();
    }

    private boolean isUnreserved(int c) {
        return (c >= 'a' && c <= 'z')
                || (c >= 'A' && c <= 'Z')
                || (c >= '0' && c <= '9')
                || c == '-' || c == '.' || c == '_' || c == '~';
    }
}
