package org.nowstart.scanner.data.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class ScannerApiException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public ScannerApiException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

}
