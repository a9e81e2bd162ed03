package io.github.yok.hirelink.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.time.LocalDateTime;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class IsoTimestampsTest {

    private static final LocalDateTime T = LocalDateTime.of(2021, 2, 10, 8, 15, 0);

    @Test
    void parseLenient_正常ケース_Z付きを指定する_UTCとして解析されること() {
        assertEquals(Optional.of(T), IsoTimestamps.parseLenient("2021-02-10T08:15:00Z"));
    }

    @Test
    void parseLenient_正常ケース_オフセット付きを指定する_UTCへ変換されること() {
        assertEquals(Optional.of(T), IsoTimestamps.parseLenient("2021-02-10T10:15:00+02:00"));
        assertEquals(Optional.of(LocalDateTime.of(2021, 2, 9, 23, 0)),
                IsoTimestamps.parseLenient("2021-02-10T08:00:00+09:00"));
    }

    @Test
    void parseLenient_正常ケース_オフセットなしを指定する_UTCとみなされること() {
        assertEquals(Optional.of(T), IsoTimestamps.parseLenient("2021-02-10T08:15:00"));
        assertEquals(Optional.of(T), IsoTimestamps.parseLenient("2021-02-10 08:15:00"));
    }

    @Test
    void parseLenient_正常ケース_日付のみを指定する_UTC0時となること() {
        assertEquals(Optional.of(LocalDateTime.of(2021, 2, 10, 0, 0)),
                IsoTimestamps.parseLenient("2021-02-10"));
    }

    @Test
    void parseLenient_正常ケース_小数秒を指定する_秒単位に切り捨てられること() {
        assertEquals(Optional.of(T), IsoTimestamps.parseLenient("2021-02-10T08:15:00.987Z"));
    }

    @Test
    void parseLenient_異常ケース_不正文字列を指定する_空が返ること() {
        assertTrue(IsoTimestamps.parseLenient("not-a-date").isEmpty());
        assertTrue(IsoTimestamps.parseLenient("2021-13-40T00:00:00Z").isEmpty());
        assertTrue(IsoTimestamps.parseLenient("  ").isEmpty());
        assertTrue(IsoTimestamps.parseLenient(null).isEmpty());
    }

    @Test
    void parseLenient_異常ケース_存在しない日付や24時を指定する_補正されず空が返ること() {
        assertTrue(IsoTimestamps.parseLenient("2021-02-30T00:00:00Z").isEmpty());
        assertTrue(IsoTimestamps.parseLenient("2021-02-10T24:00:00Z").isEmpty());
        assertTrue(IsoTimestamps.parseLenient("2021-02-29T08:15:00+02:00").isEmpty());
        assertTrue(IsoTimestamps.parseLenient("2021-04-31 00:00:00").isEmpty());
        assertTrue(IsoTimestamps.parseLenient("2021-02-30").isEmpty());
    }

    @Test
    void parseLenient_正常ケース_閏日を指定する_解析されること() {
        assertEquals(Optional.of(LocalDateTime.of(2020, 2, 29, 12, 0)),
                IsoTimestamps.parseLenient("2020-02-29T12:00:00Z"));
    }

    @Test
    void parseStrict_正常ケース_正規形式を指定する_解析されること() {
        assertEquals(Optional.of(T), IsoTimestamps.parseStrict("2021-02-10T08:15:00Z"));
    }

    @Test
    void parseStrict_異常ケース_正規形式以外を指定する_空が返ること() {
        assertTrue(IsoTimestamps.parseStrict("2021-02-10T08:15:00").isEmpty());
        assertTrue(IsoTimestamps.parseStrict("2021-02-10").isEmpty());
        assertTrue(IsoTimestamps.parseStrict("2021-02-10T08:15:00+02:00").isEmpty());
        assertTrue(IsoTimestamps.parseStrict("2021-02-30T08:15:00Z").isEmpty());
        assertTrue(IsoTimestamps.parseStrict("").isEmpty());
    }

    @Test
    void format_正常ケース_日時を指定する_正規形式で出力されること() {
        assertEquals("2021-02-10T08:15:00Z", IsoTimestamps.format(T.withNano(500_000_000)));
        assertNull(IsoTimestamps.format(null));
    }
}
