package io.github.yok.spectral.core.table;

/**
 * 列指向テーブルの 1 ブロック（行×名前付き列）です。
 */
public interface ColumnarBlock {

    /**
     * 行数を返します。
     *
     * @return 行数です
     */
    int rowCount();

    /**
     * 列が存在するかを返します。
     *
     * @param name 列名です
     * @return 存在する場合は true です
     */
    boolean hasColumn(String name);

    /**
     * スカラー列を実数配列として返します。
     *
     * @param name 列名です
     * @return 行ごとの値です
     * @throws IllegalArgumentException 列が存在しない場合に発生します
     */
    double[] doubleColumn(String name);

    /**
     * スカラー列を整数配列として返します。
     *
     * @param name 列名です
     * @return 行ごとの値です
     * @throws IllegalArgumentException 列が存在しない場合に発生します
     */
    int[] intColumn(String name);

    /**
     * 配列列（行ごとに可変長の配列を持つ列）を返します。
     *
     * @param name 列名です
     * @return 行ごとの配列です
     * @throws IllegalArgumentException 列が存在しない場合に発生します
     */
    double[][] arrayColumn(String name);
}
