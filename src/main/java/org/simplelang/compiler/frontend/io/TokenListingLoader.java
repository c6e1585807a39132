package org.simplelang.compiler.frontend.io;

import org.simplelang.compiler.frontend.lexer.Token;
import org.simplelang.compiler.frontend.lexer.TokenKind;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Loads token listings written by the lexer: one {@code <kind> <line>} pair per line,
 * where {@code <kind>} is a {@link TokenKind} name or lexeme. Blank lines and lines
 * starting with {@code #} are skipped. Supports local filesystem paths and
 * {@code classpath:} resources.
 */
public final class TokenListingLoader {

    public static final String CLASSPATH_PREFIX = "classpath:";

    /**
     * Result of loading a listing.
     *
     * @param tokens      The tokens in listing order.
     * @param logicalName The name used in diagnostics.
     */
    public record LoadResult(List<Token> tokens, String logicalName) {}

    private TokenListingLoader() {}

    /**
     * Loads a listing from a {@code classpath:} location or a filesystem path.
     *
     * @param location The location string as given on the command line.
     * @return The parsed tokens.
     * @throws IOException If the listing cannot be read.
     * @throws IllegalArgumentException If a line is not a valid token entry.
     */
    public static LoadResult load(String location) throws IOException {
        if (location.startsWith(CLASSPATH_PREFIX)) {
            return loadClasspath(location.substring(CLASSPATH_PREFIX.length()));
        }
        return loadFile(Path.of(location));
    }

    public static LoadResult loadFile(Path path) throws IOException {
        String logicalName = path.toString().replace('\\', '/');
        String content = String.join("\n", Files.readAllLines(path, StandardCharsets.UTF_8));
        return new LoadResult(parse(content, logicalName), logicalName);
    }

    public static LoadResult loadClasspath(String resourcePath) throws IOException {
        try (InputStream is = Thread.currentThread().getContextClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new IOException("Resource not found in classpath: " + resourcePath);
            }
            try (BufferedReader br = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                String content = br.lines().collect(Collectors.joining("\n"));
                return new LoadResult(parse(content, resourcePath), resourcePath);
            }
        }
    }

    /**
     * Parses listing text.
     *
     * @param content     The listing text.
     * @param logicalName The name used in error messages.
     * @return The tokens in listing order.
     * @throws IllegalArgumentException If a line is not a valid token entry.
     */
    public static List<Token> parse(String content, String logicalName) {
        List<Token> tokens = new ArrayList<>();
        String[] lines = content.split("\\r?\\n");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            tokens.add(parseEntry(line, logicalName, i + 1));
        }
        return tokens;
    }

    private static Token parseEntry(String line, String logicalName, int listingLine) {
        String[] parts = line.split("\\s+");
        if (parts.length != 2) {
            throw malformed(logicalName, listingLine, "expected '<kind> <line>' but got '" + line + "'", null);
        }
        try {
            TokenKind kind = TokenKind.fromText(parts[0]);
            int sourceLine = Integer.parseInt(parts[1]);
            return new Token(kind, sourceLine);
        } catch (IllegalArgumentException e) {
            throw malformed(logicalName, listingLine, e.getMessage(), e);
        }
    }

    private static IllegalArgumentException malformed(String logicalName, int listingLine, String detail, Throwable cause) {
        return new IllegalArgumentException(
                "Malformed token listing " + logicalName + ":" + listingLine + ": " + detail, cause);
    }
}
