package org.nowstart.scanner.service;

import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.nowstart.scanner.data.exception.ScannerApiException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

@Service
public class ScanRequestValidationService {

    public static final int MAX_SYMBOLS = 100;
    static final int MAX_SYMBOL_LENGTH = 12;

    private static final Pattern EQUITY_SYMBOL = Pattern.compile("^[A-Z]{1,5}(\\.[A-Z]{1,2})?(-[A-Z])?$");
    private static final Pattern CRYPTO_SYMBOL = Pattern.compile("^[A-Z]{2,10}-(USD|EUR|BTC|ETH)$");
    private static final Pattern PLAIN_SYMBOL = Pattern.compile("^[A-Z]{1,8}$");
    private static final Set<String> RESERVED_WORDS = Set.of("NULL", "NONE", "UNDEFINED", "TEST", "DEMO", "SAMPLE");

    /**
     * Trims, upper-cases and de-duplicates symbols, keeping first-seen order.
     *
     * @throws ScannerApiException with {@code invalid_symbols} when nothing is left, a symbol has an
     *                             unsupported format, or more than {@link #MAX_SYMBOLS} remain
     */
    public List<String> normalizeSymbols(List<String> symbols) {
        if (symbols == null) {
            throw new ScannerApiException(HttpStatus.BAD_REQUEST, "invalid_symbols", "At least one symbol is required");
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String symbol : symbols) {
            if (symbol == null || symbol.isBlank()) {
                continue;
            }
            String candidate = symbol.trim().toUpperCase(Locale.ROOT);
            requireSupportedSymbol(candidate);
            normalized.add(candidate);
        }
        if (normalized.isEmpty()) {
            throw new ScannerApiException(HttpStatus.BAD_REQUEST, "invalid_symbols", "At least one symbol is required");
        }
        if (normalized.size() > MAX_SYMBOLS) {
            throw new ScannerApiException(
                    HttpStatus.BAD_REQUEST,
                    "invalid_symbols",
                    "At most " + MAX_SYMBOLS + " symbols are allowed per request, got " + normalized.size()
            );
        }
        return List.copyOf(normalized);
    }

    private void requireSupportedSymbol(String symbol) {
        if (symbol.length() > MAX_SYMBOL_LENGTH) {
            throw invalidSymbol(symbol, "is longer than " + MAX_SYMBOL_LENGTH + " characters");
        }
        if (RESERVED_WORDS.contains(symbol)) {
            throw invalidSymbol(symbol, "is a reserved word");
        }
        if (!EQUITY_SYMBOL.matcher(symbol).matches()
                && !CRYPTO_SYMBOL.matcher(symbol).matches()
                && !PLAIN_SYMBOL.matcher(symbol).matches()) {
            throw invalidSymbol(symbol, "does not match a supported symbol format");
        }
    }

    private ScannerApiException invalidSymbol(String symbol, String reason) {
        return new ScannerApiException(HttpStatus.BAD_REQUEST, "invalid_symbols", "Symbol '" + symbol + "' " + reason);
    }

    public void validateDateRange(LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null) {
            throw new ScannerApiException(HttpStatus.BAD_REQUEST, "invalid_date_range", "startDate and endDate are required");
        }
        if (!startDate.isBefore(endDate)) {
            throw new ScannerApiException(
                    HttpStatus.BAD_REQUEST,
                    "invalid_date_range",
                    "startDate must be before endDate"
            );
        }
    }
}
