package io.github.yok.spectral.core.table;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 列指向テーブルファイルを開くリーダのインタフェースです。
 */
public interface ColumnarTableReader {

    /**
     * テーブルファイルを開きます。
     *
     * @param path ファイルのパスです
     * @return 開いたハンドルです（呼び出し側で close します）
     * @throws java.nio.file.NoSuchFileException ファイルが存在しない場合に発生します
     * @throws IOException 読み込みに失敗した場合に発生します
     */
    ColumnarTableFile open(Path path) throws IOException;
}
