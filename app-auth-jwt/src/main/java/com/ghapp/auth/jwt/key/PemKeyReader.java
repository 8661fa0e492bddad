package com.ghapp.auth.jwt.key;

import com.ghapp.auth.jwt.AppAuthException;
import com.ghapp.auth.jwt.ErrorKind;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Optional;

/**
 * Extracts the private key from a PEM file that may also hold other blocks (certificates, public keys).
 * <p>
 * Every run of five dashes toggles between the body of a block and a delimiter line. When a delimiter
 * line closes and its label does not end in {@code PRIVATE KEY}, whatever body text was collected so
 * far is thrown away, so only the body that precedes a private key trailer survives. A {@code BEGIN}
 * line also discards what came before it, which drops explanatory text ahead of the key block.
 */
public final class PemKeyReader {

    static final String PRIVATE_KEY_LABEL = "PRIVATE KEY";

    private static final String BEGIN_LABEL = "BEGIN";

    private static final int DASHES_PER_DELIMITER = 5;

    private enum State { OUTSIDE_DELIMITER, INSIDE_DELIMITER }

    private PemKeyReader() {}

    public static Optional<PrivateKeyMaterial> read(Path pemFile) {
        if (!Files.exists(pemFile)) {
            throw new AppAuthException(ErrorKind.KEY_FILE_NOT_FOUND, "Unable to locate private key file " + pemFile);
        }
        // ISO-8859-1 decodes any byte; non-ASCII text only matters if it lands in the key body
        try (Reader reader = Files.newBufferedReader(pemFile, StandardCharsets.ISO_8859_1)) {
            return read(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read private key file " + pemFile, e);
        }
    }

    public static Optional<PrivateKeyMaterial> read(Reader reader) throws IOException {
        return readBase64Body(reader).map(PemKeyReader::decode);
    }

    /**
     * Runs the delimiter state machine and returns the base64 text of the private key body, if any.
     */
    static Optional<String> readBase64Body(Reader reader) throws IOException {
        StringBuilder key = new StringBuilder(1625);
        StringBuilder label = new StringBuilder(64);
        State state = State.OUTSIDE_DELIMITER;
        boolean closedOnPrivateKey = false;
        int dashes = 0;

        int c;
        while ((c = reader.read()) >= 0) {
            if (c == '-') {
                if (++dashes == DASHES_PER_DELIMITER) {
                    dashes = 0;
                    if (state == State.OUTSIDE_DELIMITER) {
                        state = State.INSIDE_DELIMITER;
                        label.setLength(0);
                    } else {
                        state = State.OUTSIDE_DELIMITER;
                        closedOnPrivateKey = endsWithPrivateKey(label);
                        if (!closedOnPrivateKey || isBeginLabel(label)) {
                            key.setLength(0);
                        }
                    }
                }
                continue;
            }
            dashes = 0;

            if (state == State.INSIDE_DELIMITER) {
                label.append((char) c);
            } else if (!isSeparator(c)) {
                key.append((char) c);
            }
        }

        return closedOnPrivateKey ? Optional.of(key.toString()) : Optional.empty();
    }

    private static boolean isSeparator(int c) {
        return c == ' ' || c == '\n' || c == '\r' || c == '\t';
    }

    private static boolean isBeginLabel(CharSequence label) {
        return label.toString().startsWith(BEGIN_LABEL);
    }

    private static boolean endsWithPrivateKey(CharSequence label) {
        return label.toString().endsWith(PRIVATE_KEY_LABEL);
    }

    private static PrivateKeyMaterial decode(String base64) {
        try {
            return new PrivateKeyMaterial(Base64.getDecoder().decode(base64));
        } catch (IllegalArgumentException e) {
            throw new AppAuthException(ErrorKind.INVALID_KEY_MATERIAL, "Private key block is not valid base64", e);
        }
    }
}
