package io.github.yok.prismlink.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.nio.file.Paths;
import java.util.List;
import org.junit.jupiter.api.Test;

class CliArgumentsTest {

    @Test
    void parse_正常ケース_オプションとフラグが混在する_位置引数と分離されること() {
        CliArguments args = CliArguments.parse("tables", "upload", "--is-name", "sales",
                "--operation", "Upsert", "a.csv", "b.csv.gz");

        assertEquals("tables", args.getGroup());
        assertEquals("upload", args.getAction());
        assertEquals(List.of("sales", "a.csv", "b.csv.gz"), args.getPositionals());
        assertEquals("Upsert", args.option("--operation"));
        assertTrue(args.flag("--is-name"));
        assertFalse(args.flag("--search"));
        assertEquals("sales", args.positional(0));
        assertNull(args.positional(3));
        assertEquals(List.of(Paths.get("a.csv"), Paths.get("b.csv.gz")), args.paths(1));
        assertTrue(args.paths(5).isEmpty());
    }

    @Test
    void parse_正常ケース_未知のオプションと値の無いオプションを指定する_無視されること() {
        CliArguments args = CliArguments.parse("buckets", "get", "--verbose", "--limit");
        assertEquals("buckets", args.getGroup());
        assertEquals("get", args.getAction());
        assertTrue(args.getPositionals().isEmpty());
        assertNull(args.option("--limit"));
        assertNull(args.intOption("--limit"));
    }

    @Test
    void parse_正常ケース_引数なし_グループとアクションがnullとなること() {
        CliArguments args = CliArguments.parse();
        assertNull(args.getGroup());
        assertNull(args.getAction());
    }

    @Test
    void intOption_異常ケース_数値でない値を指定する_IllegalArgumentExceptionが送出されること() {
        CliArguments args = CliArguments.parse("tables", "get", "--limit", "ten", "--offset", " 5");
        assertEquals(5, args.intOption("--offset"));
        IllegalArgumentException ex =
                assertThrows(IllegalArgumentException.class, () -> args.intOption("--limit"));
        assertTrue(ex.getMessage().contains("--limit"));
    }

    @Test
    void booleanOption_正常ケース_yesとoffを指定する_真偽値に変換されること() {
        assertTrue(CliArguments.parse("t", "c", "--enable-for-analysis", "yes")
                .booleanOption("--enable-for-analysis"));
        assertFalse(CliArguments.parse("t", "c", "--enable-for-analysis", "off")
                .booleanOption("--enable-for-analysis"));
        assertThrows(IllegalArgumentException.class,
                () -> CliArguments.parse("t", "c", "--enable-for-analysis", "maybe")
                        .booleanOption("--enable-for-analysis"));
    }
}
