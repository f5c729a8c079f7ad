package io.github.yok.spectral.core.table;

import io.jhdf.HdfFile;
import io.jhdf.api.Dataset;
import io.jhdf.exceptions.HdfException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

/**
 * jHDF を用いて HDF5 ファイルから断面積テーブルを読み込むリーダです。
 *
 * <p>
 * ルート直下のデータセット {@code energy} と {@code cross_section} を読みます。 ファイルは読み込み後すぐに閉じます。
 * </p>
 */
@Slf4j
public final class Hdf5CrossSectionTableReader implements CrossSectionTableReader {

    @Override
    public CrossSectionTable read(Path path) throws IOException {
        if (path == null || !Files.isRegularFile(path)) {
            throw new NoSuchFileException(String.valueOf(path));
        }
        try (HdfFile hdf = new HdfFile(path)) {
            double[] energy = doubles(dataset(hdf, "energy"));
            double[] sigma = doubles(dataset(hdf, "cross_section"));
            log.debug("断面積テーブルを読み込みました: {}（energy={} 点、cross_section={} 点）", path,
                    energy.length, sigma.length);
            return new CrossSectionTable(energy, sigma);
        } catch (HdfException e) {
            throw new IOException("HDF5 ファイルを読み込めません: " + path, e);
        }
    }

    /**
     * 1 次元の浮動小数点データセットを double 配列として読みます。単精度は倍精度に広げます。
     */
    private static double[] doubles(Dataset dataset) {
        Object data = dataset.getData();
        if (data instanceof double[]) {
            return (double[]) data;
        }
        if (data instanceof float[]) {
            float[] values = (float[]) data;
            double[] out = new double[values.length];
            for (int i = 0; i < values.length; i++) {
                out[i] = values[i];
            }
            return out;
        }
        throw new IllegalArgumentException("1 次元の浮動小数点データセットではありません: " + dataset.getPath()
                + "（型=" + (data == null ? "null" : data.getClass().getSimpleName()) + "）");
    }

    private static Dataset dataset(HdfFile hdf, String name) {
        try {
            return hdf.getDatasetByPath(name);
        } catch (HdfException e) {
            throw new IllegalArgumentException(
                    "データセットが存在しません: " + name + "（" + hdf.getFile() + "）", e);
        }
    }
}
