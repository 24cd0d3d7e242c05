package io.github.yok.band.core.path;

import com.google.common.base.Preconditions;
import io.github.yok.band.core.dataset.Dataset;
import io.github.yok.band.core.error.DataIntegrityException;
import io.github.yok.band.core.reader.HighSymmetryPoint;
import io.github.yok.band.core.reader.LineModeKPoints;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * サンプリング方式ごとの自然な区間分割と、区間の選択・並べ替え、目盛りの計算を行うクラスです。
 *
 * <ul>
 * <li>通常計算: 高対称点のペアごとに {@code [i*n, (i+1)*n)}（n はライン形式の分割数）</li>
 * <li>ハイブリッド汎関数計算: 高対称点と一致する k 点を順に 2 つずつ組にした {@code [a, b+1)}</li>
 * <li>展開計算: 区間数 L で等分した {@code [i*n, (i+1)*n)}（n = 全 k 点数 / L）</li>
 * </ul>
 */
@Slf4j
public final class KPathResolver {

    /**
     * ハイブリッド汎関数計算で k 点と高対称点を照合するときの丸め桁（1e-5）の逆数です。
     */
    private static final double MATCH_SCALE = 1e5;

    /**
     * データセットの自然な区間分割を返します。
     *
     * @param dataset データセットです
     * @return 区間です（すべて順方向）
     * @throws DataIntegrityException k 点数がサンプリング方式と矛盾する場合に発生します
     */
    public List<PathSegment> naturalSegments(Dataset dataset) {
        Preconditions.checkNotNull(dataset, "dataset は null 不可です");
        switch (dataset.getScheme()) {
            case REGULAR:
                return regularSegments(dataset.getLineMode(), dataset.kpointCount());
            case HYBRID:
                return hybridSegments(dataset.getKpoints(), dataset.getSymmetryPoints());
            case UNFOLDED:
                return unfoldedSegments(dataset.getUnfoldLegs(), dataset.kpointCount());
            default:
                throw new IllegalStateException("未知のサンプリング方式です: " + dataset.getScheme());
        }
    }

    /**
     * 通常計算の区間分割を返します。
     *
     * <p>
     * 区間 i は k 点 {@code [i*n, (i+1)*n)} で、n は両端の高対称点を含む区間あたりの k 点数（ライン形式の分割数）です。 区間をまたぐ高対称点は前後の区間に 1 点ずつ現れるため、k
     * 点数はちょうど区間数 × n になります。
     * </p>
     *
     * @param lineMode ライン形式の k 点指定です
     * @param kpointCount k 点数です
     * @return 区間です
     * @throws DataIntegrityException 高対称点が奇数個の場合、または k 点数が一致しない場合に発生します
     */
    public List<PathSegment> regularSegments(LineModeKPoints lineMode, int kpointCount) {
        if (lineMode == null) {
            throw new DataIntegrityException("通常計算にはライン形式の高対称点が必要です");
        }
        List<HighSymmetryPoint> points = lineMode.getPoints();
        if (points.isEmpty() || points.size() % 2 != 0) {
            throw new DataIntegrityException("ライン形式の高対称点は始点・終点のペア（偶数個）が必要です: " + points.size());
        }
        int n = lineMode.getDivisions();
        int segmentCount = points.size() / 2;
        if (segmentCount * n != kpointCount) {
            throw new DataIntegrityException("k 点数が区間数 × 分割数と一致しません: " + kpointCount + " vs "
                    + segmentCount + "×" + n + "（分割数は両端の高対称点を含む区間あたりの k 点数です）");
        }
        List<PathSegment> segments = new ArrayList<>();
        for (int i = 0; i < segmentCount; i++) {
            segments.add(new PathSegment(i, i * n, (i + 1) * n, points.get(2 * i).getLabel(),
                    points.get(2 * i + 1).getLabel(), false));
        }
        return segments;
    }

    /**
     * ハイブリッド汎関数計算の区間分割を返します。
     *
     * <p>
     * k 点と高対称点の座標を 1e-5 で丸めて完全一致したものを高対称点とみなし、 一致した k 点を出現順に 2 つずつ組にして区間とします。
     * </p>
     *
     * @param kpoints k 点の分数座標です
     * @param symmetryPoints 高対称点の座標集合です
     * @return 区間です
     * @throws DataIntegrityException 一致した k 点が偶数個でない場合に発生します
     */
    public List<PathSegment> hybridSegments(double[][] kpoints,
            List<HighSymmetryPoint> symmetryPoints) {
        Preconditions.checkNotNull(kpoints, "kpoints は null 不可です");
        Preconditions.checkNotNull(symmetryPoints, "symmetryPoints は null 不可です");

        List<Integer> matched = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        for (int k = 0; k < kpoints.length; k++) {
            String label = matchLabel(kpoints[k], symmetryPoints);
            if (label != null) {
                matched.add(k);
                labels.add(label);
            }
        }
        if (matched.isEmpty() || matched.size() % 2 != 0) {
            throw new DataIntegrityException(
                    "高対称点と一致する k 点は始点・終点のペア（偶数個）が必要です: " + matched);
        }

        List<PathSegment> segments = new ArrayList<>();
        for (int i = 0; i + 1 < matched.size(); i += 2) {
            int a = matched.get(i);
            int b = matched.get(i + 1);
            segments.add(new PathSegment(i / 2, a, b + 1, labels.get(i), labels.get(i + 1), false));
        }
        log.debug("ハイブリッド汎関数計算の区間を検出しました。一致した k 点={}", matched);
        return segments;
    }

    /**
     * 展開計算の区間分割を返します。
     *
     * @param legs 区間ごとの始点・終点ラベルです
     * @param kpointCount k 点数です
     * @return 区間です
     * @throws DataIntegrityException k 点数が区間数で割り切れない場合に発生します
     */
    public List<PathSegment> unfoldedSegments(List<List<String>> legs, int kpointCount) {
        if (legs == null || legs.isEmpty()) {
            throw new DataIntegrityException("展開 k パスの区間がありません");
        }
        int legCount = legs.size();
        if (kpointCount % legCount != 0 || kpointCount / legCount < 2) {
            throw new DataIntegrityException(
                    "k 点数が区間数で割り切れません: " + kpointCount + " / " + legCount);
        }
        int n = kpointCount / legCount;
        List<PathSegment> segments = new ArrayList<>();
        for (int i = 0; i < legCount; i++) {
            List<String> leg = legs.get(i);
            segments.add(new PathSegment(i, i * n, (i + 1) * n, leg.get(0), leg.get(1), false));
        }
        return segments;
    }

    /**
     * 区間の選択・並べ替えを解決します。
     *
     * @param natural 自然な区間分割です
     * @param spec 選択の指定です（null の場合は自然な順序のまま）
     * @return 解決した区間の並びです
     * @throws io.github.yok.band.core.error.ConfigurationException 範囲外の区間番号を含む場合に発生します
     */
    public ResolvedPath resolve(List<PathSegment> natural, CustomPathSpec spec) {
        Preconditions.checkNotNull(natural, "natural は null 不可です");
        if (spec == null) {
            return new ResolvedPath(natural);
        }
        spec.validate(natural.size());
        List<PathSegment> segments = new ArrayList<>();
        for (int i = 0; i < spec.size(); i++) {
            segments.add(natural.get(spec.segmentId(i)).withReversed(spec.flipped(i)));
        }
        ResolvedPath path = new ResolvedPath(segments);
        log.info("k パスを解決しました。指定={}、区間={}", spec, path);
        return path;
    }

    /**
     * 目盛りを計算します。
     *
     * <p>
     * 目盛りは先頭、各区間境界、末尾に 1 つずつ置きます。点番号は区間境界の点を 1 点として数えた位置で、 {@code 0} に続けて各区間の
     * {@code 点数 - 1} を累積した値です。境界のラベルは {@link KPointLabels#merge} でまとめます。
     * </p>
     *
     * @param path 解決した区間の並びです
     * @param distances 区間ごとの距離（進行方向）です
     * @return 目盛りです（区間数 + 1 個）
     */
    public List<TickMark> ticks(ResolvedPath path, List<double[]> distances) {
        Preconditions.checkNotNull(path, "path は null 不可です");
        Preconditions.checkNotNull(distances, "distances は null 不可です");
        Preconditions.checkArgument(distances.size() == path.size(), "距離の区間数が一致しません: %s vs %s",
                distances.size(), path.size());

        List<TickMark> ticks = new ArrayList<>();
        PathSegment first = path.segment(0);
        ticks.add(new TickMark(0, distances.get(0)[0], KPointLabels.format(first.firstLabel())));

        int index = 0;
        for (int i = 0; i < path.size(); i++) {
            PathSegment segment = path.segment(i);
            double[] d = distances.get(i);
            Preconditions.checkArgument(d.length == segment.length(), "区間 %s の距離の点数が一致しません", i);
            index += segment.length() - 1;
            String end = KPointLabels.format(segment.lastLabel());
            String label = i + 1 < path.size()
                    ? KPointLabels.merge(end, KPointLabels.format(path.segment(i + 1).firstLabel()))
                    : end;
            ticks.add(new TickMark(index, d[d.length - 1], label));
        }
        return ticks;
    }

    private static String matchLabel(double[] k, List<HighSymmetryPoint> symmetryPoints) {
        long[] key = roundKey(k);
        for (HighSymmetryPoint point : symmetryPoints) {
            if (Arrays.equals(key, roundKey(point.getCoordinates()))) {
                return point.getLabel();
            }
        }
        return null;
    }

    private static long[] roundKey(double[] k) {
        long[] out = new long[k.length];
        for (int i = 0; i < k.length; i++) {
            out[i] = Math.round(k[i] * MATCH_SCALE);
        }
        return out;
    }
}
