package io.github.yok.spectral.core.backend;

/**
 * 外部ツール上に生成したモデルのハンドルです。
 */
public interface FittingToolModel {

    /**
     * 成分のパラメータを設定します。
     *
     * @param component 成分名（例: "apec", "powerlaw"）です
     * @param parameter パラメータ名（例: "kT", "norm"）です
     * @param value 値です
     */
    void setParameter(String component, String parameter, double value);

    /**
     * 現在のパラメータでチャネルごとのモデル値を評価します。
     *
     * @param spectrumIndex スペクトル番号です（通常 0）
     * @return チャネルごとの値です
     */
    double[] values(int spectrumIndex);
}
