package org.iomclient.broker;

import lombok.Builder;
import lombok.Value;

/**
 * How a record set is opened and how many rows travel per round trip.
 */
@Value
@Builder
public class RecordSetOptions {

    public enum CursorType {
        UNSPECIFIED(-1), FORWARD_ONLY(0), KEYSET(1), DYNAMIC(2), STATIC(3);

        private final int code;

        CursorType(int code) {
            this.code = code;
        }

        public int getCode() {
            return code;
        }
    }

    public enum LockType {
        UNSPECIFIED(-1), READ_ONLY(1), PESSIMISTIC(2), OPTIMISTIC(3), BATCH_OPTIMISTIC(4);

        private final int code;

        LockType(int code) {
            this.code = code;
        }

        public int getCode() {
            return code;
        }
    }

    public enum CommandType {
        UNSPECIFIED(-1), TEXT(1), TABLE(2), STORED_PROC(4), UNKNOWN(8), FILE(256), TABLE_DIRECT(512);

        private final int code;

        CommandType(int code) {
            this.code = code;
        }

        public int getCode() {
            return code;
        }
    }

    CursorType cursorType;
    LockType lockType;
    CommandType commandType;
    // server side row cache
    int maximumOpenRows;
    // download buffer in rows
    int pageSize;
    // client side record cache
    int cacheSize;
}
