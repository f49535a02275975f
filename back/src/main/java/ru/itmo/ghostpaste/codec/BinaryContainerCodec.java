package ru.itmo.ghostpaste.codec;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import ru.itmo.ghostpaste.config.GhostPasteProperties;
import ru.itmo.ghostpaste.exception.InvalidBinaryFormatException;
import ru.itmo.ghostpaste.exception.InvalidInputException;
import ru.itmo.ghostpaste.model.GistFile;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Packs several files into one flat byte sequence and back.
 *
 * <pre>
 * header:  magic "GPST" (4) | version (1) | file count (2) | total content size (4)
 * entry:   name length (2) | name UTF-8 | content length (4) | content | language length (1) | language UTF-8
 * </pre>
 *
 * All integers are little-endian. The container is never modified in place; decode always
 * builds a new file list.
 */
@Component
@Slf4j
public class BinaryContainerCodec {

    public static final int MAGIC_NUMBER = 0x47505354;
    public static final int FORMAT_VERSION = 1;
    public static final int HEADER_SIZE = 11;

    private final GhostPasteProperties.Limits limits;

    public BinaryContainerCodec() {
        this(new GhostPasteProperties.Limits());
    }

    @Autowired
    public BinaryContainerCodec(GhostPasteProperties properties) {
        this(properties.getLimits());
    }

    BinaryContainerCodec(GhostPasteProperties.Limits limits) {
        this.limits = limits;
    }

    public byte[] encode(List<GistFile> files) {
        if (files == null || files.isEmpty()) {
            throw new InvalidInputException("No files provided for encoding");
        }
        if (files.size() > limits.getMaxFileCount()) {
            throw new InvalidInputException("Too many files: " + files.size()
                    + " exceeds limit of " + limits.getMaxFileCount());
        }

        List<byte[]> names = new ArrayList<>(files.size());
        List<byte[]> languages = new ArrayList<>(files.size());
        long totalContentSize = 0;
        long encodedSize = HEADER_SIZE;

        for (GistFile file : files) {
            if (file.getName() == null || file.getName().isEmpty()) {
                throw new InvalidInputException("File name cannot be empty");
            }
            byte[] name = file.getName().getBytes(StandardCharsets.UTF_8);
            if (name.length > limits.getMaxFilenameBytes()) {
                throw new InvalidInputException("Filename too long: " + name.length
                        + " bytes exceeds limit of " + limits.getMaxFilenameBytes());
            }
            // length 0 on the wire means "no language", so an empty tag would not survive decode
            if (file.getLanguage() != null && file.getLanguage().isEmpty()) {
                throw new InvalidInputException("Language identifier cannot be empty for file \""
                        + file.getName() + "\"; omit it instead");
            }
            byte[] language = file.getLanguage() == null
                    ? new byte[0]
                    : file.getLanguage().getBytes(StandardCharsets.UTF_8);
            if (language.length > limits.getMaxLanguageBytes()) {
                throw new InvalidInputException("Language identifier too long: " + language.length
                        + " bytes exceeds limit of " + limits.getMaxLanguageBytes());
            }
            int contentLength = contentOf(file).length;
            if (contentLength > limits.getMaxFileSize()) {
                throw InvalidInputException.tooLarge("File \"" + file.getName() + "\"",
                        limits.getMaxFileSize(), contentLength);
            }

            names.add(name);
            languages.add(language);
            totalContentSize += contentLength;
            encodedSize += 2 + name.length + 4 + contentLength + 1 + language.length;
        }

        if (encodedSize > limits.getMaxTotalSize()) {
            throw InvalidInputException.tooLarge("Container", limits.getMaxTotalSize(), encodedSize);
        }

        ByteBuffer buffer = ByteBuffer.allocate((int) encodedSize);
        writeUint32(buffer, MAGIC_NUMBER);
        buffer.put((byte) FORMAT_VERSION);
        writeUint16(buffer, files.size());
        writeUint32(buffer, (int) totalContentSize);

        for (int i = 0; i < files.size(); i++) {
            byte[] content = contentOf(files.get(i));
            writeUint16(buffer, names.get(i).length);
            buffer.put(names.get(i));
            writeUint32(buffer, content.length);
            buffer.put(content);
            buffer.put((byte) languages.get(i).length);
            buffer.put(languages.get(i));
        }

        log.debug("Encoded {} files into {} bytes ({} content bytes)", files.size(), encodedSize, totalContentSize);
        return buffer.array();
    }

    public List<GistFile> decode(byte[] data) {
        if (data == null || data.length < HEADER_SIZE) {
            throw new InvalidBinaryFormatException("Binary data too small to contain valid header");
        }
        ByteBuffer buffer = ByteBuffer.wrap(data);

        int magic = readUint32(buffer);
        if (magic != MAGIC_NUMBER) {
            throw new InvalidBinaryFormatException("Invalid magic number: expected "
                    + Integer.toHexString(MAGIC_NUMBER) + ", got " + Integer.toHexString(magic));
        }
        int version = buffer.get() & 0xFF;
        if (version != FORMAT_VERSION) {
            throw new InvalidBinaryFormatException("Unsupported version: expected "
                    + FORMAT_VERSION + ", got " + version);
        }
        int fileCount = readUint16(buffer);
        if (fileCount == 0 || fileCount > limits.getMaxFileCount()) {
            throw new InvalidBinaryFormatException("Invalid file count: " + fileCount
                    + " (must be 1-" + limits.getMaxFileCount() + ")");
        }
        long totalSize = readUint32(buffer) & 0xFFFFFFFFL;
        if (totalSize > limits.getMaxTotalSize()) {
            throw new InvalidBinaryFormatException("Total size too large: " + totalSize
                    + " exceeds limit of " + limits.getMaxTotalSize());
        }

        List<GistFile> files = new ArrayList<>(fileCount);
        long decodedSize = 0;
        for (int i = 1; i <= fileCount; i++) {
            int nameLength = readUint16(require(buffer, 2, "filename length", i));
            if (nameLength == 0 || nameLength > limits.getMaxFilenameBytes()) {
                throw new InvalidBinaryFormatException("Invalid filename length: " + nameLength + " for file " + i);
            }
            String name = readUtf8(require(buffer, nameLength, "filename", i), nameLength, i);

            long contentLength = readUint32(require(buffer, 4, "content length", i)) & 0xFFFFFFFFL;
            if (contentLength > limits.getMaxFileSize()) {
                throw new InvalidBinaryFormatException("File too large: " + contentLength
                        + " exceeds limit of " + limits.getMaxFileSize());
            }
            byte[] content = new byte[(int) contentLength];
            require(buffer, content.length, "content", i).get(content);
            decodedSize += contentLength;

            int languageLength = require(buffer, 1, "language length", i).get() & 0xFF;
            if (languageLength > limits.getMaxLanguageBytes()) {
                throw new InvalidBinaryFormatException("Language identifier too long: " + languageLength
                        + " exceeds limit of " + limits.getMaxLanguageBytes());
            }
            String language = languageLength == 0
                    ? null
                    : readUtf8(require(buffer, languageLength, "language", i), languageLength, i);

            files.add(new GistFile(name, content, language));
        }

        if (buffer.hasRemaining()) {
            throw new InvalidBinaryFormatException(buffer.remaining()
                    + " trailing bytes after " + fileCount + " declared files");
        }
        if (decodedSize != totalSize) {
            throw new InvalidBinaryFormatException("Size mismatch: decoded " + decodedSize
                    + " bytes, expected " + totalSize);
        }
        return files;
    }

    private static byte[] contentOf(GistFile file) {
        return file.getContent() == null ? new byte[0] : file.getContent();
    }

    private static ByteBuffer require(ByteBuffer buffer, int length, String field, int fileIndex) {
        if (buffer.remaining() < length) {
            throw new InvalidBinaryFormatException("Unexpected end of data while reading "
                    + field + " for file " + fileIndex);
        }
        return buffer;
    }

    private static String readUtf8(ByteBuffer buffer, int length, int fileIndex) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer slice = buffer.slice();
        slice.limit(length);
        buffer.position(buffer.position() + length);
        try {
            CharBuffer chars = decoder.decode(slice);
            return chars.toString();
        } catch (CharacterCodingException e) {
            throw new InvalidBinaryFormatException("Invalid UTF-8 text in file " + fileIndex);
        }
    }

    private static void writeUint16(ByteBuffer buffer, int value) {
        for (int i = 0; i < 2; i++) {
            buffer.put((byte) ((value >>> (i * 8)) & 0xFF));
        }
    }

    private static void writeUint32(ByteBuffer buffer, int value) {
        for (int i = 0; i < 4; i++) {
            buffer.put((byte) ((value >>> (i * 8)) & 0xFF));
        }
    }

    private static int readUint16(ByteBuffer buffer) {
        return (buffer.get() & 0xFF) | ((buffer.get() & 0xFF) << 8);
    }

    private static int readUint32(ByteBuffer buffer) {
        int value = 0;
        for (int i = 0; i < 4; i++) {
            value |= (buffer.get() & 0xFF) << (i * 8);
        }
        return value;
    }
}
