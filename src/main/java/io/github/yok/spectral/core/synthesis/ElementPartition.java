package io.github.yok.spectral.core.synthesis;

/**
 * 微量元素/宇宙組成グループと金属グループへの元素の分割です。
 *
 * <p>
 * 下流で金属量だけを独立にスケールできるよう、固定の表として定義します。
 * </p>
 */
public enum ElementPartition {

    /**
     * H, He と微量元素です。
     */
    TRACE(1, 2, 3, 4, 5, 9, 11, 15, 17, 19, 21, 22, 23, 24, 25, 27, 29, 30),

    /**
     * 微量でない金属です。
     */
    METAL(6, 7, 8, 10, 12, 13, 14, 16, 18, 20, 26, 28);

    private final int[] elements;

    ElementPartition(int... elements) {
        this.elements = elements;
    }

    /**
     * このグループの原子番号（コピー）を返します。
     *
     * @return 原子番号です
     */
    public int[] elements() {
        return elements.clone();
    }

    /**
     * 原子番号がこのグループに属するかを返します。
     *
     * @param element 原子番号です
     * @return 属する場合は true です
     */
    public boolean contains(int element) {
        for (int z : elements) {
            if (z == element) {
                return true;
            }
        }
        return false;
    }
}
