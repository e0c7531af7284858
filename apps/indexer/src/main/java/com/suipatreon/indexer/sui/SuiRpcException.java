package com.suipatreon.indexer.sui;

/**
 * Failure talking to a Sui fullnode. {@code code} is the JSON-RPC error code, null for
 * transport failures.
 */
public class SuiRpcException extends RuntimeException {

    /**
     * JSON-RPC "invalid params"; the node answers with it for a cursor it cannot resume from.
     */
    public static final int INVALID_PARAMS = -32602;

    private final Integer code;

    public SuiRpcException(Integer code, String message) {
        super(message);
        this.code = code;
    }

    public SuiRpcException(String message, Throwable cause) {
        super(message, cause);
        this.code = null;
    }

    public Integer getCode() {
        return code;
    }

    public boolean isInvalidParams() {
        return code != null && code == INVALID_PARAMS;
    }
}
