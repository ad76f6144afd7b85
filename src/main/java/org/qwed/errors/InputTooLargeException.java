package org.qwed.errors;

import lombok.Getter;

import java.util.Map;

@Getter
public final class InputTooLargeException extends InputException {

    private final long actualBytes;
    private final long maxBytes;

    public InputTooLargeException(long actualBytes, long maxBytes) {
        super("INPUT_TOO_LARGE", "输入长度 " + actualBytes + " 字节超过上限 " + maxBytes + " 字节", SourcePosition.START);
        this.actualBytes = actualBytes;
        this.maxBytes = maxBytes;
    }

    @Override
    protected void addDetails(Map<String, Object> details) {
        details.put("actualBytes", actualBytes);
        details.put("maxBytes", maxBytes);
    }
}
