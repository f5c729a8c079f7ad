package io.github.yok.spectral.core.backend;

/**
 * 外部スペクトルフィッティングツールのグローバル設定を表すセッションです。
 *
 * <p>
 * ツール側の出力レベル・エネルギーグリッド・モデル文字列はプロセス全体で共有されるため、
 * 同じツールを使う複数のモデルを同時に使う場合は呼び出し側で直列化してください。
 * </p>
 */
public interface FittingToolSession {

    /**
     * 出力レベル（chatter）を設定します。
     *
     * @param level 出力レベルです（0 で抑制）
     */
    void setChatter(int level);

    /**
     * モデル評価に使うエネルギーグリッドを設定します。
     *
     * @param emin 最小エネルギー（keV）です
     * @param emax 最大エネルギー（keV）です
     * @param nchan チャネル数です
     * @param binning ビニング（"lin" など）です
     */
    void setEnergies(double emin, double emax, int nchan, String binning);

    /**
     * モデル文字列（キー・値）を追加します。
     *
     * @param key キーです
     * @param value 値です
     */
    void addModelString(String key, String value);

    /**
     * モデル式からモデルを生成します。
     *
     * @param expression モデル式（例: "apec", "wabs*powerlaw"）です
     * @return 生成したモデルです
     */
    FittingToolModel createModel(String expression);
}
