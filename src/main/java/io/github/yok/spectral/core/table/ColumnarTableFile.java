package io.github.yok.spectral.core.table;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;

/**
 * インデックス付きブロック（FITS の HDU に相当）を持つ列指向テーブルファイルのハンドルです。
 *
 * <p>
 * ブロック 0 はヘッダ用、ブロック 1 以降がデータブロックです。
 * </p>
 */
public interface ColumnarTableFile extends Closeable {

    /**
     * ファイルのパスを返します。
     *
     * @return パスです
     */
    Path path();

    /**
     * 指定インデックスのブロックを返します。
     *
     * @param index ブロックインデックスです
     * @return ブロックです
     * @throws IOException 読み込みに失敗した場合に発生します
     * @throws IllegalArgumentException ブロックが存在しない、または表形式でない場合に発生します
     */
    ColumnarBlock block(int index) throws IOException;
}
