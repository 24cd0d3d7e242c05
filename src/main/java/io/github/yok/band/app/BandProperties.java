package io.github.yok.band.app;

import io.github.yok.band.core.dataset.DatasetRequest;
import io.github.yok.band.core.dataset.SocAxis;
import io.github.yok.band.core.dataset.Spin;
import io.github.yok.band.core.error.ConfigurationException;
import io.github.yok.band.core.path.CustomPathSpec;
import io.github.yok.band.core.plot.PlotOptions;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;
import javax.validation.constraints.Size;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * バンド構造の再構成に使う設定値（band.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の読み込み条件と描画条件の組み立てに使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "band")
public class BandProperties {

    /**
     * バンド計算のフォルダです。
     */
    @NotBlank
    private String folder;

    /**
     * フェルミエネルギーを読むフォルダです（未指定の場合は folder と同じ）。
     */
    private String efermiFolder;

    /**
     * フェルミエネルギーに加えるずらし量（eV）です。
     */
    private double shiftEfermi = 0.0;

    /**
     * スピン方向です。
     */
    @NotNull
    private Spin spin = Spin.UP;

    /**
     * 展開計算のデータとして読み込むかどうかです。
     */
    private boolean unfold = false;

    /**
     * 展開計算の設定です。
     */
    @Valid
    private UnfoldSettings unfoldSettings = new UnfoldSettings();

    /**
     * スピン軌道計算で擬スピンを定義するスピン軸です（未指定の場合は使いません）。
     */
    private SocAxis socAxis;

    /**
     * 射影重みを読み込むかどうかです。
     */
    private boolean projected = false;

    /**
     * 固有値に掛ける倍率です。
     */
    @Positive
    private double stretchFactor = 1.0;

    /**
     * 区間ごとに補間するかどうかです。
     */
    private boolean interpolate = true;

    /**
     * 区間あたりの補間点数です。
     */
    @Min(2)
    private int newN = 200;

    /**
     * 区間の選択・並べ替え（1 始まり、負の値は逆向き）です。
     */
    private List<Integer> customKpath;

    /**
     * 表示するエネルギー範囲 [min, max]（eV）です。
     */
    @NotNull
    @Size(min = 2, max = 2)
    private List<Double> energyWindow = List.of(-6.0, 6.0);

    /**
     * 表示の設定です。
     */
    @Valid
    private View view = new View();

    /**
     * 出力設定です。
     */
    private Output output = new Output();

    /**
     * データセットの読み込み条件を組み立てます。
     *
     * @return 読み込み条件です
     * @throws ConfigurationException 展開計算の設定が不正な場合に発生します
     */
    public DatasetRequest toDatasetRequest() {
        DatasetRequest.DatasetRequestBuilder b = DatasetRequest.builder()
                .folder(Paths.get(folder))
                .efermiFolder(efermiFolder == null || efermiFolder.isBlank() ? null
                        : Paths.get(efermiFolder))
                .shiftEfermi(shiftEfermi).spin(spin).unfold(unfold).socAxis(socAxis)
                .projected(projected).stretchFactor(stretchFactor);
        if (unfold) {
            UnfoldSettings u = unfoldSettings;
            b.unfoldLegs(parseLegs(u.getKpath()))
                    .highSymmetryPoints(parseVectors(u.getHighSymmetryPoints(),
                            "unfold-settings.high-symmetry-points"))
                    .pointsPerLeg(u.getN());
            if (u.getTransform() != null && !u.getTransform().isEmpty()) {
                List<double[]> rows = parseVectors(u.getTransform(), "unfold-settings.transform");
                if (rows.size() != 3) {
                    throw new ConfigurationException(
                            "unfold-settings.transform は 3 行が必要です: " + rows.size());
                }
                b.transform(rows.toArray(new double[0][]));
            }
        }
        return b.build();
    }

    /**
     * 描画条件を組み立てます。
     *
     * @return 描画条件です
     * @throws ConfigurationException custom-kpath が不正な場合に発生します
     */
    public PlotOptions toPlotOptions() {
        CustomPathSpec custom = customKpath == null || customKpath.isEmpty() ? null
                : CustomPathSpec.of(customKpath);
        return PlotOptions.builder().customPath(custom).interpolate(interpolate).newN(newN)
                .energyMin(energyWindow.get(0)).energyMax(energyWindow.get(1)).build();
    }

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "band")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        UnfoldSettings u = getUnfoldSettings();
        View v = getView();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "dataset",
                // folder: バンド計算のフォルダ
                "folder", getFolder(),
                // efermiFolder: フェルミエネルギーを読むフォルダ
                "efermiFolder", getEfermiFolder(),
                // shiftEfermi: フェルミエネルギーのずらし量
                "shiftEfermi", getShiftEfermi(),
                // spin: スピン方向（UP/DOWN）
                "spin", getSpin(),
                // socAxis: 擬スピンのスピン軸（X/Y/Z）
                "socAxis", getSocAxis(),
                // projected: 射影重みを読み込むかどうか
                "projected", isProjected(),
                // stretchFactor: 固有値の倍率
                "stretchFactor", getStretchFactor());

        appendSection(sb, nl, "unfold",
                // enabled: 展開計算として読み込むかどうか
                "enabled", isUnfold(),
                // kpath: 区間ラベル
                "kpath", u.getKpath(),
                // n: 区間あたりの点数
                "n", u.getN(),
                // highSymmetryPoints: 高対称点
                "highSymmetryPoints", u.getHighSymmetryPoints(),
                // transform: 変換行列
                "transform", u.getTransform());

        appendSection(sb, nl, "plot",
                // interpolate: 区間ごとに補間するかどうか
                "interpolate", isInterpolate(),
                // newN: 区間あたりの補間点数
                "newN", getNewN(),
                // customKpath: 区間の選択・並べ替え
                "customKpath", getCustomKpath(),
                // energyWindow: 表示するエネルギー範囲
                "energyWindow", getEnergyWindow());

        appendSection(sb, nl, "view",
                // kind: 表示の種類
                "kind", v.getKind(),
                "orbitals", v.getOrbitals(),
                "spd", v.getSpd(),
                "atoms", v.getAtoms(),
                "atomOrbitals", v.getAtomOrbitals(),
                "atomSpd", v.getAtomSpd(),
                "elements", v.getElements(),
                "elementOrbitals", v.getElementOrbitals(),
                "elementSpd", v.getElementSpd());

        appendSection(sb, nl, "output",
                // dir: 出力先ディレクトリ
                "dir", getOutput().getDir());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    /**
     * "G-X" 形式の区間ラベルを分解します。
     *
     * @param legs 区間ラベルです
     * @return 区間ごとの始点・終点ラベルです
     * @throws ConfigurationException 形式が不正な場合に発生します
     */
    static List<List<String>> parseLegs(List<String> legs) {
        if (legs == null || legs.isEmpty()) {
            throw new ConfigurationException("unfold-settings.kpath は必須です");
        }
        List<List<String>> out = new ArrayList<>();
        for (String leg : legs) {
            String[] parts = leg == null ? new String[0] : leg.trim().split("-");
            if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
                throw new ConfigurationException("区間ラベルは \"A-B\" 形式で指定してください: " + leg);
            }
            out.add(List.of(parts[0].trim(), parts[1].trim()));
        }
        return out;
    }

    /**
     * 空白区切りの 3 成分ベクトルを分解します。
     *
     * @param rows "x y z" 形式の文字列です
     * @param key エラーメッセージに使う設定キーです
     * @return ベクトルです
     * @throws ConfigurationException 形式が不正な場合に発生します
     */
    static List<double[]> parseVectors(List<String> rows, String key) {
        if (rows == null || rows.isEmpty()) {
            throw new ConfigurationException(key + " は必須です");
        }
        List<double[]> out = new ArrayList<>();
        for (String row : rows) {
            String[] parts = row == null ? new String[0] : row.trim().split("\\s+");
            if (parts.length != 3) {
                throw new ConfigurationException(key + " は \"x y z\" 形式で指定してください: " + row);
            }
            double[] v = new double[3];
            for (int i = 0; i < 3; i++) {
                try {
                    v[i] = Double.parseDouble(parts[i]);
                } catch (NumberFormatException e) {
                    throw new ConfigurationException(key + " に数値でない成分があります: " + row, e);
                }
            }
            out.add(v);
        }
        return out;
    }

    @Data
    public static class UnfoldSettings {

        /**
         * 区間ラベル（"G-X" 形式）の一覧です。
         */
        private List<String> kpath = List.of();

        /**
         * 区間あたりの点数です。
         */
        @Min(1)
        private int n = 40;

        /**
         * 高対称点（基本セルの分数座標、"x y z" 形式）の一覧です。
         */
        private List<String> highSymmetryPoints = List.of();

        /**
         * スーパーセルから基本セルへの変換行列（3 行、"a b c" 形式）です。
         *
         * <p>
         * 展開結果のキャッシュがある場合は不要です。
         * </p>
         */
        private List<String> transform = List.of();
    }

    @Data
    public static class View {

        /**
         * 表示の種類です。
         */
        @NotNull
        private PlotViewFactory.ViewKind kind = PlotViewFactory.ViewKind.PLAIN;

        /**
         * 軌道インデックスの一覧です（ORBITALS）。
         */
        private List<Integer> orbitals = List.of();

        /**
         * 軌道区分の並び（例: spd）です（SPD）。
         */
        private String spd = "spd";

        /**
         * 原子インデックスの一覧です（ATOMS）。
         */
        private List<Integer> atoms = List.of();

        /**
         * "原子:軌道" 形式の組の一覧です（ATOM_ORBITALS）。
         */
        private List<String> atomOrbitals = List.of();

        /**
         * "原子:区分" 形式の組の一覧です（ATOM_SPD）。
         */
        private List<String> atomSpd = List.of();

        /**
         * 元素記号の一覧です（ELEMENTS）。
         */
        private List<String> elements = List.of();

        /**
         * "元素:軌道" 形式の組の一覧です（ELEMENT_ORBITALS）。
         */
        private List<String> elementOrbitals = List.of();

        /**
         * "元素:区分" 形式の組の一覧です（ELEMENT_SPD）。
         */
        private List<String> elementSpd = List.of();
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        private String dir = "./out";
    }
}
