package io.github.yok.spectral.core.model;

/**
 * スペクトルモデルの準備状態です。
 *
 * <p>
 * {@code UNPREPARED} から {@code prepare} の成功で {@code PREPARED} に遷移し、以後は何度でも問い合わせできます。
 * </p>
 */
public enum PreparationState {

    /**
     * 未準備（テーブル未オープン、外部ツール未設定）です。
     */
    UNPREPARED,

    /**
     * 準備済みです。
     */
    PREPARED
}
