package io.github.yok.spectral.core.table;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import io.github.yok.spectral.core.error.TableNotFoundException;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * ライン表・連続成分表のハンドルと、読み込み済みの温度グリッド・ブロックを保持するキャッシュです。
 *
 * <p>
 * {@link #open()} で両方のファイルを開き、どちらかが開けない場合は何も保持せずに失敗します。 ブロックは初回参照時に読み込み、以後は再利用します。
 * </p>
 */
@Slf4j
public final class TableCache implements AutoCloseable {

    /**
     * 温度グリッド（列 kT）を格納したブロックのインデックスです。
     */
    static final int TEMPERATURE_BLOCK = 1;

    /**
     * ライン表のパスです。
     */
    private final Path lineFile;

    /**
     * 連続成分表のパスです。
     */
    private final Path continuumFile;

    /**
     * テーブルファイルのリーダです。
     */
    private final ColumnarTableReader reader;

    private ColumnarTableFile lineHandle;

    private ColumnarTableFile continuumHandle;

    private TemperatureGrid temperatureGrid;

    private final Map<Integer, LineList> lineLists = new HashMap<>();

    private final Map<Integer, ContinuumTable> continuumTables = new HashMap<>();

    /**
     * キャッシュを生成します（ファイルはまだ開きません）。
     *
     * @param lineFile ライン表のパスです
     * @param continuumFile 連続成分表のパスです
     * @param reader テーブルファイルのリーダです
     */
    public TableCache(Path lineFile, Path continuumFile, ColumnarTableReader reader) {
        this.lineFile = checkNotNull(lineFile, "lineFile は null 不可です");
        this.continuumFile = checkNotNull(continuumFile, "continuumFile は null 不可です");
        this.reader = checkNotNull(reader, "reader は null 不可です");
    }

    /**
     * 両方のテーブルを開き、温度グリッドを読み込みます。
     *
     * <p>
     * 既に開いている場合は何もしません。
     * </p>
     *
     * @throws TableNotFoundException いずれかのファイルが存在しない場合に発生します
     * @throws IllegalStateException 読み込みに失敗した場合に発生します
     */
    public void open() {
        if (isOpen()) {
            return;
        }
        ColumnarTableFile line = openTable("LINE", lineFile);
        ColumnarTableFile coco;
        try {
            coco = openTable("COCO", continuumFile);
        } catch (RuntimeException e) {
            closeQuietly(line, e);
            throw e;
        }

        TemperatureGrid grid;
        try {
            grid = new TemperatureGrid(line.block(TEMPERATURE_BLOCK).doubleColumn("kT"));
        } catch (IOException | RuntimeException e) {
            closeQuietly(line, e);
            closeQuietly(coco, e);
            if (e instanceof RuntimeException) {
                throw (RuntimeException) e;
            }
            throw new IllegalStateException("温度グリッドを読み込めません: " + lineFile, e);
        }

        this.lineHandle = line;
        this.continuumHandle = coco;
        this.temperatureGrid = grid;
        log.info("スペクトルテーブルを開きました。LINE={}、COCO={}、温度点数={}（{}〜{} keV）", lineFile,
                continuumFile, grid.size(), grid.min(), grid.max());
    }

    /**
     * テーブルが開いているかを返します。
     *
     * @return 開いている場合は true です
     */
    public boolean isOpen() {
        return lineHandle != null;
    }

    /**
     * 温度グリッドを返します。
     *
     * @return 温度グリッドです
     * @throws IllegalStateException 未オープンの場合に発生します
     */
    public TemperatureGrid temperatureGrid() {
        checkState(isOpen(), "テーブルが開かれていません");
        return temperatureGrid;
    }

    /**
     * 指定ブロックの輝線リストを返します。
     *
     * @param block ブロックインデックスです
     * @return 輝線リストです
     */
    public LineList lineList(int block) {
        checkState(isOpen(), "テーブルが開かれていません");
        return lineLists.computeIfAbsent(block, b -> LineList.from(read(lineHandle, b)));
    }

    /**
     * 指定ブロックの連続成分テーブルを返します。
     *
     * @param block ブロックインデックスです
     * @return 連続成分テーブルです
     */
    public ContinuumTable continuumTable(int block) {
        checkState(isOpen(), "テーブルが開かれていません");
        return continuumTables.computeIfAbsent(block,
                b -> ContinuumTable.from(read(continuumHandle, b)));
    }

    /**
     * ハンドルを閉じ、キャッシュを破棄します。
     *
     * @throws IllegalStateException クローズに失敗した場合に発生します
     */
    @Override
    public void close() {
        if (!isOpen()) {
            return;
        }
        lineLists.clear();
        continuumTables.clear();
        ColumnarTableFile line = lineHandle;
        ColumnarTableFile coco = continuumHandle;
        lineHandle = null;
        continuumHandle = null;
        temperatureGrid = null;
        try (line; coco) {
            log.debug("スペクトルテーブルを閉じます。LINE={}、COCO={}", lineFile, continuumFile);
        } catch (IOException e) {
            throw new IllegalStateException("テーブルのクローズに失敗しました: " + lineFile, e);
        }
    }

    private ColumnarTableFile openTable(String kind, Path path) {
        try {
            return reader.open(path);
        } catch (NoSuchFileException e) {
            log.error("{} ファイルが存在しません: {}", kind, path);
            throw new TableNotFoundException(kind, path, e);
        } catch (IOException e) {
            throw new IllegalStateException(kind + " ファイルを開けません: " + path, e);
        }
    }

    private static ColumnarBlock read(ColumnarTableFile file, int block) {
        try {
            return file.block(block);
        } catch (IOException e) {
            throw new IllegalStateException(
                    "テーブルブロックを読み込めません: " + file.path() + " [" + block + "]", e);
        }
    }

    private static void closeQuietly(ColumnarTableFile file, Exception primary) {
        try {
            file.close();
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }
}
