package io.github.yok.band.core.path;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * 選択・並べ替えを反映した区間の並びです。
 *
 * <p>
 * 同じ区間が複数回、または逆向きで現れることがあります。各区間はデータセットの配列を参照するだけで、 値を取り出すのは {@link #slice} の呼び出し時です。
 * </p>
 */
public final class ResolvedPath {

    private final ImmutableList<PathSegment> segments;

    /**
     * 区間の並びを生成します。
     *
     * @param segments 区間です（1 件以上）
     */
    public ResolvedPath(List<PathSegment> segments) {
        Preconditions.checkNotNull(segments, "segments は null 不可です");
        Preconditions.checkArgument(!segments.isEmpty(), "区間は 1 件以上が必要です");
        this.segments = ImmutableList.copyOf(segments);
    }

    public ImmutableList<PathSegment> segments() {
        return segments;
    }

    public int size() {
        return segments.size();
    }

    public PathSegment segment(int i) {
        return segments.get(i);
    }

    /**
     * 区間ごとの逆向きフラグを返します。
     *
     * @return フラグです
     */
    public boolean[] flipFlags() {
        boolean[] out = new boolean[segments.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = segments.get(i).isReversed();
        }
        return out;
    }

    /**
     * 区間ごとの区間番号（0 始まり）を返します。
     *
     * @return 区間番号です
     */
    public int[] segmentIds() {
        int[] out = new int[segments.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = segments.get(i).getSegmentId();
        }
        return out;
    }

    /**
     * 区間境界の重複を含めた全点数を返します。
     *
     * @return 点数です
     */
    public int totalPoints() {
        int total = 0;
        for (PathSegment segment : segments) {
            total += segment.length();
        }
        return total;
    }

    /**
     * 1 バンド分の値から i 番目の区間を進行方向で取り出します。
     *
     * @param row k 点ごとの値です
     * @param i 区間の位置です
     * @return 区間の値です
     */
    public double[] slice(double[] row, int i) {
        int[] indices = segments.get(i).indices();
        double[] out = new double[indices.length];
        for (int j = 0; j < indices.length; j++) {
            out[j] = row[indices[j]];
        }
        return out;
    }

    /**
     * k 点座標から i 番目の区間を進行方向で取り出します。
     *
     * @param kpoints {@code [k][3]} の座標です
     * @param i 区間の位置です
     * @return 区間の座標です（行は参照のまま）
     */
    public double[][] sliceKpoints(double[][] kpoints, int i) {
        int[] indices = segments.get(i).indices();
        double[][] out = new double[indices.length][];
        for (int j = 0; j < indices.length; j++) {
            out[j] = kpoints[indices[j]];
        }
        return out;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ResolvedPath[");
        for (int i = 0; i < segments.size(); i++) {
            PathSegment s = segments.get(i);
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(s.isReversed() ? -(s.getSegmentId() + 1) : s.getSegmentId() + 1);
            sb.append(':').append(s.firstLabel()).append("->").append(s.lastLabel());
        }
        return sb.append(']').toString();
    }
}
