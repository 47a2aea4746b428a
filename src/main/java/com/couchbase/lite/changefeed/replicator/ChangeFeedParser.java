package com.couchbase.lite.changefeed.replicator;

import com.couchbase.lite.changefeed.util.Log;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Map;

/**
 * Parses one batch of the _changes feed: a JSON array of change objects. Bytes are fed in with
 * {@link #parseBytes} and the batch is finished with {@link #endParsingData()}.
 */
public class ChangeFeedParser {

    public interface ChangeHandler {
        /**
         * @return false if the change is invalid, which fails the whole batch
         */
        boolean receivedChange(Map<String, Object> change);
    }

    private static final TypeReference<Map<String, Object>> CHANGE_TYPE = new TypeReference<Map<String, Object>>() {};

    private final ObjectMapper mapper;
    private final ChangeHandler handler;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private boolean sawArrayStart;

    public ChangeFeedParser(ObjectMapper mapper, ChangeHandler handler) {
        this.mapper = mapper;
        this.handler = handler;
    }

    /**
     * Adds bytes to the current batch.
     * @return false if the data can't be the start of a change array
     */
    public boolean parseBytes(byte[] bytes, int offset, int length) {
        if (!sawArrayStart) {
            for (int i = offset; i < offset + length; i++) {
                byte b = bytes[i];
                if (b == ' ' || b == '\t' || b == '\r' || b == '\n') {
                    continue;
                }
                if (b != '[') {
                    Log.w(Log.TAG_CHANGE_TRACKER, "%s: change batch doesn't start with '['", this);
                    return false;
                }
                sawArrayStart = true;
                break;
            }
        }
        buffer.write(bytes, offset, length);
        return true;
    }

    /**
     * Parses the bytes collected since the last call, handing each change to the handler.
     * @return the number of changes in the batch, or -1 if it was malformed
     */
    public int endParsingData() {
        byte[] data = buffer.toByteArray();
        reset();
        int count = 0;
        try (JsonParser jp = mapper.getFactory().createParser(data)) {
            if (jp.nextToken() != JsonToken.START_ARRAY) {
                return -1;
            }
            while (jp.nextToken() == JsonToken.START_OBJECT) {
                Map<String, Object> change = mapper.readValue(jp, CHANGE_TYPE);
                if (!handler.receivedChange(change)) {
                    return -1;
                }
                count++;
            }
            if (jp.currentToken() != JsonToken.END_ARRAY || jp.nextToken() != null) {
                Log.w(Log.TAG_CHANGE_TRACKER, "%s: unexpected %s in change batch", this, jp.currentToken());
                return -1;
            }
        } catch (IOException e) {
            Log.w(Log.TAG_CHANGE_TRACKER, "Unparseable change batch", e);
            return -1;
        }
        return count;
    }

    /**
     * Discards a partially received batch.
     */
    public void reset() {
        buffer.reset();
        sawArrayStart = false;
    }
}
