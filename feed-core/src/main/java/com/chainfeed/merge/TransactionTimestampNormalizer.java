package com.chainfeed.merge;

import com.chainfeed.domain.BitcoinTransaction;
import com.chainfeed.domain.FeedTransaction;
import com.chainfeed.domain.SourceKind;
import com.chainfeed.domain.SparkTransaction;
import com.chainfeed.domain.StacksTransaction;
import com.chainfeed.domain.StarknetTransaction;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Maps a feed transaction to its {@link MergeKey}.
 * <ul>
 *     <li>bitcoin: block time, 0 when unconfirmed</li>
 *     <li>stacks: block time when &gt; 0, else burn block time (any value), else PENDING</li>
 *     <li>starknet: ISO-8601 block timestamp, required</li>
 *     <li>spark: ISO-8601 creation time or whole epoch milliseconds, epoch 0 when absent</li>
 * </ul>
 * Timestamp text accepts an instant, an offset date-time, a local date-time (read as UTC, with either
 * {@code T} or a single space between date and time) or a bare date (UTC midnight). Sub-second
 * precision is floored to whole seconds.
 */
public final class TransactionTimestampNormalizer {

    private static final Pattern SPACE_SEPARATED_DATE_TIME = Pattern.compile("^\\d{4}-\\d{2}-\\d{2} \\d");
    private static final Pattern EPOCH_MILLIS = Pattern.compile("^-?\\d+$");

    private static final List<Function<String, Instant>> PARSERS = List.of(
            Instant::parse,
            s -> OffsetDateTime.parse(s).toInstant(),
            s -> LocalDateTime.parse(s).toInstant(ZoneOffset.UTC),
            s -> LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant()
    );

    private static final FeedTransaction.Visitor<MergeKey> KEY_EXTRACTOR = new FeedTransaction.Visitor<>() {

        @Override
        public MergeKey visitBitcoin(BitcoinTransaction tx) {
            Long blockTime = tx.data() != null ? tx.data().blockTime() : null;
            return MergeKey.ofEpochSeconds(blockTime != null ? blockTime : 0L);
        }

        @Override
        public MergeKey visitStacks(StacksTransaction tx) {
            StacksTransaction.Tx inner = tx.data() != null ? tx.data().tx() : null;
            if (inner == null) {
                return MergeKey.PENDING;
            }
            if (inner.blockTime() != null && inner.blockTime() > 0) {
                return MergeKey.ofEpochSeconds(inner.blockTime());
            }
            if (inner.burnBlockTime() != null) {
                return MergeKey.ofEpochSeconds(inner.burnBlockTime());
            }
            return MergeKey.PENDING;
        }

        @Override
        public MergeKey visitStarknet(StarknetTransaction tx) {
            String raw = tx.data() != null ? tx.data().blockTimestamp() : null;
            return MergeKey.ofEpochSeconds(parseEpochSeconds(SourceKind.STARKNET, raw));
        }

        @Override
        public MergeKey visitSpark(SparkTransaction tx) {
            String raw = tx.data() != null ? tx.data().createdAt() : null;
            if (raw == null) {
                return MergeKey.ofEpochSeconds(0L);
            }
            // numeric createdAt arrives as epoch milliseconds
            if (EPOCH_MILLIS.matcher(raw.trim()).matches()) {
                return MergeKey.ofEpochSeconds(parseEpochMillisAsSeconds(SourceKind.SPARK, raw));
            }
            return MergeKey.ofEpochSeconds(parseEpochSeconds(SourceKind.SPARK, raw));
        }
    };

    private TransactionTimestampNormalizer() {
    }

    /**
     * @throws MalformedTimestampException when a starknet or spark timestamp cannot be parsed
     */
    public static MergeKey mergeKey(FeedTransaction tx) {
        return tx.accept(KEY_EXTRACTOR);
    }

    static long parseEpochMillisAsSeconds(SourceKind kind, String raw) {
        try {
            return Math.floorDiv(Long.parseLong(raw.trim()), 1000L);
        } catch (NumberFormatException e) {
            throw new MalformedTimestampException(kind, raw, e);
        }
    }

    static long parseEpochSeconds(SourceKind kind, String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedTimestampException(kind, raw, null);
        }
        String text = raw.trim();
        if (SPACE_SEPARATED_DATE_TIME.matcher(text).find()) {
            text = text.substring(0, 10) + 'T' + text.substring(11);
        }
        DateTimeException last = null;
        for (Function<String, Instant> parser : PARSERS) {
            try {
                Instant instant = parser.apply(text);
                return Math.floorDiv(instant.toEpochMilli(), 1000L);
            } catch (DateTimeException e) {
                last = e;
            } catch (ArithmeticException e) {
                throw new MalformedTimestampException(kind, raw, e);
            }
        }
        throw new MalformedTimestampException(kind, raw, last);
    }
}
