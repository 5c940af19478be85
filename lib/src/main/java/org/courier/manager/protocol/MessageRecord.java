package org.courier.manager.protocol;

import com.google.protobuf.CodedInputStream;
import com.google.protobuf.CodedOutputStream;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.WireFormat;

import org.courier.manager.api.Attachment;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Message as exchanged between two contacts, before sealing.
 * A record with an empty body is an acknowledgement of the message named by {@code inReplyTo}.
 *
 * @param time      seconds since the epoch, set by the sender
 * @param myNextDh  the sender's current ratchet public value
 */
public record MessageRecord(
        long id,
        long time,
        byte[] body,
        BodyEncoding bodyEncoding,
        Optional<Long> inReplyTo,
        byte[] myNextDh,
        List<Attachment> files
) {

    private static final int ID_TAG = 1 << 3 | WireFormat.WIRETYPE_FIXED64;
    private static final int TIME_TAG = 2 << 3 | WireFormat.WIRETYPE_VARINT;
    private static final int BODY_TAG = 3 << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;
    private static final int BODY_ENCODING_TAG = 4 << 3 | WireFormat.WIRETYPE_VARINT;
    private static final int IN_REPLY_TO_TAG = 5 << 3 | WireFormat.WIRETYPE_FIXED64;
    private static final int MY_NEXT_DH_TAG = 6 << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;
    private static final int FILES_TAG = 7 << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;

    private static final int FILENAME_TAG = 1 << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;
    private static final int CONTENTS_TAG = 2 << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;

    public enum BodyEncoding {
        RAW(0),
        GZIP(1);

        private final int number;

        BodyEncoding(int number) {
            this.number = number;
        }

        public int getNumber() {
            return number;
        }

        static BodyEncoding forNumber(int number) {
            for (final var encoding : values()) {
                if (encoding.number == number) {
                    return encoding;
                }
            }
            return null;
        }
    }

    public MessageRecord {
        files = files == null ? List.of() : List.copyOf(files);
    }

    public boolean isAcknowledgement() {
        return body.length == 0;
    }

    public int getSerializedSize() {
        var size = CodedOutputStream.computeFixed64Size(1, id)
                + CodedOutputStream.computeInt64Size(2, time)
                + CodedOutputStream.computeByteArraySize(3, body)
                + CodedOutputStream.computeEnumSize(4, bodyEncoding.getNumber());
        if (inReplyTo.isPresent()) {
            size += CodedOutputStream.computeFixed64Size(5, inReplyTo.get());
        }
        if (myNextDh != null) {
            size += CodedOutputStream.computeByteArraySize(6, myNextDh);
        }
        for (final var file : files) {
            final var fileSize = getSerializedSize(file);
            size += CodedOutputStream.computeTagSize(7) + CodedOutputStream.computeUInt32SizeNoTag(fileSize) + fileSize;
        }
        return size;
    }

    public byte[] serialize() {
        final var bytes = new byte[getSerializedSize()];
        final var out = CodedOutputStream.newInstance(bytes);
        try {
            out.writeFixed64(1, id);
            out.writeInt64(2, time);
            out.writeByteArray(3, body);
            out.writeEnum(4, bodyEncoding.getNumber());
            if (inReplyTo.isPresent()) {
                out.writeFixed64(5, inReplyTo.get());
            }
            if (myNextDh != null) {
                out.writeByteArray(6, myNextDh);
            }
            for (final var file : files) {
                out.writeTag(7, WireFormat.WIRETYPE_LENGTH_DELIMITED);
                out.writeUInt32NoTag(getSerializedSize(file));
                out.writeString(1, file.filename());
                out.writeByteArray(2, file.contents());
            }
            out.checkNoSpaceLeft();
        } catch (IOException e) {
            throw new AssertionError("Writing to a sized array failed", e);
        }
        return bytes;
    }

    public static MessageRecord parse(byte[] bytes) throws InvalidProtocolBufferException {
        final var in = CodedInputStream.newInstance(bytes);
        Long id = null;
        Long time = null;
        byte[] body = null;
        BodyEncoding bodyEncoding = null;
        Long inReplyTo = null;
        byte[] myNextDh = null;
        final var files = new ArrayList<Attachment>();
        try {
            var done = false;
            while (!done) {
                final var tag = in.readTag();
                switch (tag) {
                    case 0 -> done = true;
                    case ID_TAG -> id = in.readFixed64();
                    case TIME_TAG -> time = in.readInt64();
                    case BODY_TAG -> body = in.readByteArray();
                    case BODY_ENCODING_TAG -> {
                        bodyEncoding = BodyEncoding.forNumber(in.readEnum());
                        if (bodyEncoding == null) {
                            throw new InvalidProtocolBufferException("Unknown body encoding");
                        }
                    }
                    case IN_REPLY_TO_TAG -> inReplyTo = in.readFixed64();
                    case MY_NEXT_DH_TAG -> myNextDh = in.readByteArray();
                    case FILES_TAG -> files.add(parseAttachment(in.readByteArray()));
                    default -> done = !in.skipField(tag);
                }
            }
        } catch (InvalidProtocolBufferException e) {
            throw e;
        } catch (IOException e) {
            throw new InvalidProtocolBufferException(e);
        }
        if (id == null || time == null || body == null || bodyEncoding == null) {
            throw new InvalidProtocolBufferException("Message record is missing required fields");
        }
        return new MessageRecord(id, time, body, bodyEncoding, Optional.ofNullable(inReplyTo), myNextDh, files);
    }

    private static int getSerializedSize(Attachment file) {
        return CodedOutputStream.computeStringSize(1, file.filename())
                + CodedOutputStream.computeByteArraySize(2, file.contents());
    }

    private static Attachment parseAttachment(byte[] bytes) throws IOException {
        final var in = CodedInputStream.newInstance(bytes);
        String filename = null;
        byte[] contents = null;
        var done = false;
        while (!done) {
            final var tag = in.readTag();
            switch (tag) {
                case 0 -> done = true;
                case FILENAME_TAG -> filename = in.readStringRequireUtf8();
                case CONTENTS_TAG -> contents = in.readByteArray();
                default -> done = !in.skipField(tag);
            }
        }
        if (filename == null || contents == null) {
            throw new InvalidProtocolBufferException("Attachment is missing required fields");
        }
        return new Attachment(filename, contents);
    }
}
