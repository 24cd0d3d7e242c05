package io.github.yok.band.core.cache;

/**
 * キャッシュする派生配列の種類です。
 *
 * <p>
 * いずれもスピン・軸の選択前の配列を保存します。選択はロード後に行うため、 同じキャッシュを異なる spin / soc 軸の指定で再利用できます。
 * </p>
 */
public enum DerivedKind {

    /**
     * 固有値（フェルミ補正済み）と k 点座標を末尾軸に連結した配列 {@code (bands, k, 2*channels+3)} です。
     */
    MERGED_RAW("eigenvalues.npy", 3),

    /**
     * 展開結果 {@code (channels, 3, bands, kPath)} です。
     */
    UNFOLDED_RAW("unfolded_eigenvalues.npy", 4),

    /**
     * 符号付き射影成分 {@code (bands, k, components, atoms, orbitals)} です。
     */
    PROJECTED_RAW("projected_eigenvalues.npy", 5),

    /**
     * スピン軸射影 {@code (bands, k, components)} です。
     */
    SPIN_AXIS_RAW("spin_projections.npy", 3);

    private final String fileName;

    private final int rank;

    DerivedKind(String fileName, int rank) {
        this.fileName = fileName;
        this.rank = rank;
    }

    /**
     * キャッシュファイル名を返します。
     *
     * @return ファイル名です
     */
    public String fileName() {
        return fileName;
    }

    /**
     * 期待する次元数を返します。
     *
     * @return 次元数です
     */
    public int rank() {
        return rank;
    }
}
