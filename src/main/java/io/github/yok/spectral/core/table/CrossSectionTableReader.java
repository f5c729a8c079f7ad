package io.github.yok.spectral.core.table;

import java.io.IOException;
import java.nio.file.Path;

/**
 * キー・バリュー形式のテーブルファイルから吸収断面積テーブルを読み込むリーダです。
 */
public interface CrossSectionTableReader {

    /**
     * 断面積テーブルを読み込みます。
     *
     * @param path ファイルのパスです
     * @return 断面積テーブルです
     * @throws java.nio.file.NoSuchFileException ファイルが存在しない場合に発生します
     * @throws IOException 読み込みに失敗した場合に発生します
     */
    CrossSectionTable read(Path path) throws IOException;
}
