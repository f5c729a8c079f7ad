package io.github.yok.spectral.core.table;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.spectral.core.error.TableNotFoundException;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TableCacheTest {

    private static final Path LINE = Paths.get("/t/line.fits");

    private static final Path COCO = Paths.get("/t/coco.fits");

    private InMemoryColumnarTable line;

    private InMemoryColumnarTable coco;

    @BeforeEach
    void setUp() {
        line = new InMemoryColumnarTable(LINE)
                .put(1, new InMemoryColumnarTable.Block().column("kT", new double[] {0.5, 1.0}))
                .put(2, new InMemoryColumnarTable.Block().column("element", new int[] {1})
                        .column("lambda", new double[] {12.0})
                        .column("epsilon", new double[] {1.0}));
        coco = new InMemoryColumnarTable(COCO);
    }

    @Test
    @DisplayName("open で温度グリッドを読み込み、ブロックは一度だけ組み立ててキャッシュする")
    void openReadsTemperaturesAndCachesBlocks() {
        TableCache cache = new TableCache(LINE, COCO, new InMemoryTableReader().add(line).add(coco));
        assertFalse(cache.isOpen());

        cache.open();

        assertTrue(cache.isOpen());
        assertEquals(2, cache.temperatureGrid().size());
        assertEquals(1.0, cache.temperatureGrid().max(), 0.0);
        LineList first = cache.lineList(2);
        assertSame(first, cache.lineList(2));
        assertEquals(1, first.size());

        cache.close();
        assertFalse(cache.isOpen());
        assertTrue(line.isClosed());
        assertTrue(coco.isClosed());
    }

    @Test
    @DisplayName("ライン表が無い場合は TableNotFoundException（パス付き）")
    void missingLineFile() {
        TableCache cache = new TableCache(LINE, COCO, new InMemoryTableReader().add(coco));

        TableNotFoundException e = assertThrows(TableNotFoundException.class, cache::open);
        assertEquals(LINE, e.getPath());
        assertFalse(cache.isOpen());
    }

    @Test
    @DisplayName("連続成分表が無い場合は先に開いたライン表を閉じて失敗する")
    void missingContinuumFileClosesLine() {
        TableCache cache = new TableCache(LINE, COCO, new InMemoryTableReader().add(line));

        TableNotFoundException e = assertThrows(TableNotFoundException.class, cache::open);
        assertEquals(COCO, e.getPath());
        assertTrue(line.isClosed());
        assertFalse(cache.isOpen());
    }

    @Test
    @DisplayName("未オープンのままブロックを参照すると IllegalStateException")
    void accessBeforeOpen() {
        TableCache cache = new TableCache(LINE, COCO, new InMemoryTableReader());
        assertThrows(IllegalStateException.class, cache::temperatureGrid);
        assertThrows(IllegalStateException.class, () -> cache.lineList(2));
        assertThrows(IllegalStateException.class, () -> cache.continuumTable(2));
    }

    @Test
    @DisplayName("FITS リーダは存在しないファイルに対して NoSuchFileException を投げ、キャッシュで TableNotFoundException になる")
    void fitsReaderMissingFile(@TempDir Path dir) {
        Path missing = dir.resolve("apec_v2.0.2_line.fits");
        assertThrows(java.nio.file.NoSuchFileException.class,
                () -> new FitsColumnarTableReader().open(missing));

        TableCache cache = new TableCache(missing, dir.resolve("apec_v2.0.2_coco.fits"),
                new FitsColumnarTableReader());
        assertThrows(TableNotFoundException.class, cache::open);
    }
}
