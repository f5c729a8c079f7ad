package io.github.yok.spectral.core.table;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.TableHDU;
import nom.tam.util.ArrayFuncs;

/**
 * nom-tam-fits を用いて FITS バイナリテーブルを列指向テーブルとして開くリーダです。
 *
 * <p>
 * ブロックインデックスは HDU インデックスにそのまま対応します（0 はプライマリ HDU）。
 * </p>
 */
@Slf4j
public final class FitsColumnarTableReader implements ColumnarTableReader {

    @Override
    public ColumnarTableFile open(Path path) throws IOException {
        if (path == null || !Files.isRegularFile(path)) {
            throw new NoSuchFileException(String.valueOf(path));
        }
        try {
            Fits fits = new Fits(path.toFile());
            log.debug("FITS ファイルを開きました: {}", path);
            return new FitsTableFile(path, fits);
        } catch (FitsException e) {
            throw new IOException("FITS ファイルを開けません: " + path, e);
        }
    }

    /**
     * 開いた FITS ファイルのハンドルです。
     */
    private static final class FitsTableFile implements ColumnarTableFile {

        private final Path path;

        private final Fits fits;

        /**
         * 読み込み済みブロックです。
         */
        private final Map<Integer, ColumnarBlock> blocks = new HashMap<>();

        FitsTableFile(Path path, Fits fits) {
            this.path = path;
            this.fits = fits;
        }

        @Override
        public Path path() {
            return path;
        }

        @Override
        public ColumnarBlock block(int index) throws IOException {
            ColumnarBlock cached = blocks.get(index);
            if (cached != null) {
                return cached;
            }
            BasicHDU<?> hdu;
            try {
                hdu = fits.getHDU(index);
            } catch (FitsException e) {
                throw new IOException("HDU を読み込めません: " + path + " [" + index + "]", e);
            }
            if (hdu == null) {
                throw new IllegalArgumentException("HDU が存在しません: " + path + " [" + index + "]");
            }
            if (!(hdu instanceof TableHDU)) {
                throw new IllegalArgumentException(
                        "HDU が表形式ではありません: " + path + " [" + index + "]");
            }
            ColumnarBlock block = new FitsBlock(path, index, (TableHDU<?>) hdu);
            blocks.put(index, block);
            return block;
        }

        @Override
        public void close() throws IOException {
            blocks.clear();
            fits.close();
        }
    }

    /**
     * FITS テーブル HDU を {@link ColumnarBlock} として見せるアダプタです。
     */
    private static final class FitsBlock implements ColumnarBlock {

        private final Path path;

        private final int index;

        private final TableHDU<?> hdu;

        FitsBlock(Path path, int index, TableHDU<?> hdu) {
            this.path = path;
            this.index = index;
            this.hdu = hdu;
        }

        @Override
        public int rowCount() {
            return hdu.getNRows();
        }

        @Override
        public boolean hasColumn(String name) {
            return hdu.findColumn(name) >= 0;
        }

        @Override
        public double[] doubleColumn(String name) {
            return (double[]) ArrayFuncs.convertArray(scalarColumn(name), double.class);
        }

        @Override
        public int[] intColumn(String name) {
            return (int[]) ArrayFuncs.convertArray(scalarColumn(name), int.class);
        }

        @Override
        public double[][] arrayColumn(String name) {
            Object data = column(name);
            if (!(data instanceof Object[])) {
                // 繰り返し数 1 の列は 1 次元で返るので、各行を長さ 1 の配列とみなす
                double[] values = (double[]) ArrayFuncs.convertArray(data, double.class);
                double[][] rows = new double[values.length][];
                for (int i = 0; i < values.length; i++) {
                    rows[i] = new double[] {values[i]};
                }
                return rows;
            }
            Object[] cells = (Object[]) data;
            double[][] rows = new double[cells.length][];
            for (int i = 0; i < cells.length; i++) {
                rows[i] = (double[]) ArrayFuncs.convertArray(ArrayFuncs.flatten(cells[i]),
                        double.class);
            }
            return rows;
        }

        /**
         * 1 行 1 要素の列を 1 次元の配列として取り出します。
         *
         * <p>
         * 長さ 1 の配列列として格納された場合（{@code [nrows][1]}）も平坦化して受け付けます。
         * </p>
         */
        private Object scalarColumn(String name) {
            Object flat = ArrayFuncs.flatten(column(name));
            int length = ArrayFuncs.getDimensions(flat)[0];
            if (length != rowCount()) {
                throw new IllegalArgumentException("スカラー列ではありません: " + name + "（" + path + " ["
                        + index + "]、要素数=" + length + "、行数=" + rowCount() + "）");
            }
            return flat;
        }

        private Object column(String name) {
            int col = hdu.findColumn(name);
            if (col < 0) {
                throw new IllegalArgumentException(
                        "列が存在しません: " + name + "（" + path + " [" + index + "]）");
            }
            try {
                return hdu.getColumn(col);
            } catch (FitsException e) {
                throw new IllegalStateException(
                        "列を読み込めません: " + name + "（" + path + " [" + index + "]）", e);
            }
        }
    }
}
