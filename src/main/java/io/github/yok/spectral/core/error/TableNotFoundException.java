package io.github.yok.spectral.core.error;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import lombok.Getter;

/**
 * テーブルファイル（ライン表・連続成分表・断面積表）が存在しない場合に発生する例外です。
 */
@Getter
public class TableNotFoundException extends UncheckedIOException {

    private static final long serialVersionUID = 1L;

    /**
     * 見つからなかったテーブルファイルのパスです。
     */
    private final transient Path path;

    /**
     * 例外を生成します。
     *
     * @param kind テーブルの種別（LINE/COCO など）です
     * @param path 見つからなかったパスです
     * @param cause 原因です
     */
    public TableNotFoundException(String kind, Path path, IOException cause) {
        super(kind + " ファイルが存在しません: " + path, cause);
        this.path = path;
    }
}
