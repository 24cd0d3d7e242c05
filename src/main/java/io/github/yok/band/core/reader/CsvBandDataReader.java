package io.github.yok.band.core.reader;

import io.github.yok.band.core.array.NdArray;
import io.github.yok.band.core.error.DataIntegrityException;
import io.github.yok.band.core.structure.OrbitalTable;
import io.github.yok.band.core.structure.StructureInfo;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * 外部の変換ツールが書き出した CSV 交換形式を読み込む Reader です。
 *
 * <p>
 * フォルダ内のファイル構成は次のとおりです。
 * </p>
 *
 * <ul>
 * <li>{@code meta.csv}（key,value）: efermi, ispin, lsorbit, lhfcalc, line-divisions</li>
 * <li>{@code structure.csv}（kind,c1,c2,c3）: lattice 行 ×3、species 行（記号, 原子数）</li>
 * <li>{@code kpoints.csv}（k,kx,ky,kz,weight）</li>
 * <li>{@code eigenvalues.csv}（spin,k,band,energy,occupation）</li>
 * <li>{@code high-symmetry.csv}（label,kx,ky,kz）: 任意</li>
 * <li>{@code projections.csv}（component,k,band,atom,orbital,value）: 任意</li>
 * <li>{@code spin-axis.csv}（component,k,band,value）: 任意</li>
 * </ul>
 */
@Slf4j
public final class CsvBandDataReader implements BandDataReader {

    static final String META_FILE = "meta.csv";
    static final String STRUCTURE_FILE = "structure.csv";
    static final String KPOINTS_FILE = "kpoints.csv";
    static final String EIGENVALUES_FILE = "eigenvalues.csv";
    static final String HIGH_SYMMETRY_FILE = "high-symmetry.csv";
    static final String PROJECTIONS_FILE = "projections.csv";
    static final String SPIN_AXIS_FILE = "spin-axis.csv";

    /**
     * スピン軌道計算の射影成分数（total, x, y, z）です。
     */
    private static final int SOC_COMPONENTS = 4;

    @Override
    public BandMetadata readMetadata(Path folder) {
        Map<String, String> meta = readMeta(folder);
        StructureInfo structure = readStructure(folder.resolve(STRUCTURE_FILE));

        boolean spinPolarized = parseInt(meta, "ispin", 1) == 2;
        boolean spinOrbit = parseFlag(meta, "lsorbit");
        boolean hybrid = parseFlag(meta, "lhfcalc");

        Path highSymmetryFile = folder.resolve(HIGH_SYMMETRY_FILE);
        List<HighSymmetryPoint> points =
                Files.isRegularFile(highSymmetryFile) ? readHighSymmetryPoints(highSymmetryFile)
                        : List.of();

        LineModeKPoints lineMode = null;
        if (!hybrid && !points.isEmpty()) {
            int divisions = parseInt(meta, "line-divisions", -1);
            if (divisions <= 1) {
                throw new DataIntegrityException(
                        "line-divisions は 2 以上が必要です: " + folder.resolve(META_FILE));
            }
            lineMode = new LineModeKPoints(divisions, points);
        }

        log.debug("メタ情報を読み込みました。folder={}、ispin={}、lsorbit={}、lhfcalc={}、高対称点={}", folder,
                spinPolarized ? 2 : 1, spinOrbit, hybrid, points.size());

        return new BandMetadata(structure, spinPolarized, spinOrbit, hybrid, lineMode,
                hybrid ? points : List.of());
    }

    @Override
    public double readFermiEnergy(Path folder) {
        Map<String, String> meta = readMeta(folder);
        String raw = meta.get("efermi");
        if (raw == null) {
            throw new DataIntegrityException(
                    "efermi が見つかりません: " + folder.resolve(META_FILE));
        }
        double efermi = parseDouble(raw, META_FILE + ":efermi");
        if (!Double.isFinite(efermi)) {
            throw new DataIntegrityException("efermi が有限値ではありません: " + raw);
        }
        return efermi;
    }

    @Override
    public RawEigenvalues readEigenvalues(Path folder) {
        List<CSVRecord> kRecords = readRecords(folder.resolve(KPOINTS_FILE));
        int nk = kRecords.size();
        double[][] kpoints = new double[nk][3];
        double[] weights = new double[nk];
        for (CSVRecord r : kRecords) {
            int k = index(r, "k", nk);
            kpoints[k][0] = parseDouble(value(r, "kx"), KPOINTS_FILE);
            kpoints[k][1] = parseDouble(value(r, "ky"), KPOINTS_FILE);
            kpoints[k][2] = parseDouble(value(r, "kz"), KPOINTS_FILE);
            weights[k] = parseDouble(value(r, "weight"), KPOINTS_FILE);
        }

        List<CSVRecord> eRecords = readRecords(folder.resolve(EIGENVALUES_FILE));
        int channels = 0;
        int bands = 0;
        for (CSVRecord r : eRecords) {
            channels = Math.max(channels, parseIndex(r, "spin") + 1);
            bands = Math.max(bands, parseIndex(r, "band") + 1);
        }
        if (channels == 0 || channels > 2) {
            throw new DataIntegrityException("スピンチャネル数が不正です: " + channels);
        }

        List<double[][]> energies = new ArrayList<>();
        List<double[][]> occupations = new ArrayList<>();
        for (int c = 0; c < channels; c++) {
            energies.add(new double[nk][bands]);
            occupations.add(new double[nk][bands]);
        }
        for (CSVRecord r : eRecords) {
            int spin = parseIndex(r, "spin");
            int k = index(r, "k", nk);
            int band = parseIndex(r, "band");
            energies.get(spin)[k][band] = parseDouble(value(r, "energy"), EIGENVALUES_FILE);
            occupations.get(spin)[k][band] = parseDouble(value(r, "occupation"), EIGENVALUES_FILE);
        }
        if ((long) channels * nk * bands != eRecords.size()) {
            throw new DataIntegrityException("eigenvalues.csv の行数が spin×k×band と一致しません: "
                    + eRecords.size() + " vs " + ((long) channels * nk * bands));
        }

        log.info("固有値を読み込みました。チャネル数={}、k点数={}、バンド数={}", channels, nk, bands);
        return new RawEigenvalues(energies, occupations, kpoints, weights);
    }

    @Override
    public NdArray readProjections(Path folder) {
        BandMetadata metadata = readMetadata(folder);
        int components = metadata.isSpinOrbit() ? SOC_COMPONENTS
                : (metadata.isSpinPolarized() ? 2 : 1);
        int atoms = metadata.getStructure().totalAtoms();
        int orbitals = OrbitalTable.forStructure(metadata.getStructure()).orbitalCount();

        List<CSVRecord> records = readRecords(folder.resolve(PROJECTIONS_FILE));
        int nk = 0;
        int bands = 0;
        for (CSVRecord r : records) {
            nk = Math.max(nk, parseIndex(r, "k") + 1);
            bands = Math.max(bands, parseIndex(r, "band") + 1);
        }

        NdArray out = NdArray.zeros(bands, nk, components, atoms, orbitals);
        for (CSVRecord r : records) {
            int component = index(r, "component", components);
            int atom = index(r, "atom", atoms);
            int orbital = index(r, "orbital", orbitals);
            out.set(parseDouble(value(r, "value"), PROJECTIONS_FILE), parseIndex(r, "band"),
                    parseIndex(r, "k"), component, atom, orbital);
        }
        log.info("射影重みを読み込みました。shape={}", out);
        return out;
    }

    @Override
    public NdArray readSpinAxisProjections(Path folder) {
        List<CSVRecord> records = readRecords(folder.resolve(SPIN_AXIS_FILE));
        int nk = 0;
        int bands = 0;
        for (CSVRecord r : records) {
            nk = Math.max(nk, parseIndex(r, "k") + 1);
            bands = Math.max(bands, parseIndex(r, "band") + 1);
        }
        NdArray out = NdArray.zeros(bands, nk, SOC_COMPONENTS);
        for (CSVRecord r : records) {
            out.set(parseDouble(value(r, "value"), SPIN_AXIS_FILE), parseIndex(r, "band"),
                    parseIndex(r, "k"), index(r, "component", SOC_COMPONENTS));
        }
        log.info("スピン軸射影を読み込みました。shape={}", out);
        return out;
    }

    /**
     * meta.csv を key → value の表として読み込みます。
     *
     * @param folder フォルダです
     * @return key を小文字化した表です
     */
    private static Map<String, String> readMeta(Path folder) {
        Map<String, String> meta = new HashMap<>();
        for (CSVRecord r : readRecords(folder.resolve(META_FILE))) {
            meta.put(value(r, "key").trim().toLowerCase(Locale.ROOT), value(r, "value").trim());
        }
        return meta;
    }

    /**
     * structure.csv を読み込みます。
     *
     * @param file ファイルです
     * @return 構造情報です
     */
    private static StructureInfo readStructure(Path file) {
        double[][] lattice = new double[3][];
        int latticeRows = 0;
        List<String> symbols = new ArrayList<>();
        List<Integer> counts = new ArrayList<>();

        for (CSVRecord r : readRecords(file)) {
            String kind = value(r, "kind").trim().toLowerCase(Locale.ROOT);
            if ("lattice".equals(kind)) {
                if (latticeRows == 3) {
                    throw new DataIntegrityException("lattice 行が 3 行を超えています: " + file);
                }
                lattice[latticeRows++] = new double[] {parseDouble(value(r, "c1"), file.toString()),
                        parseDouble(value(r, "c2"), file.toString()),
                        parseDouble(value(r, "c3"), file.toString())};
            } else if ("species".equals(kind)) {
                symbols.add(value(r, "c1").trim());
                counts.add((int) parseDouble(value(r, "c2"), file.toString()));
            } else {
                throw new DataIntegrityException("structure.csv の kind が不正です: " + kind);
            }
        }
        if (latticeRows != 3) {
            throw new DataIntegrityException("lattice 行は 3 行が必要です: " + file);
        }
        try {
            return new StructureInfo(symbols, counts, lattice);
        } catch (IllegalArgumentException e) {
            throw new DataIntegrityException("structure.csv の内容が不正です: " + file, e);
        }
    }

    /**
     * high-symmetry.csv を記述順に読み込みます。
     *
     * @param file ファイルです
     * @return 高対称点です
     */
    private static List<HighSymmetryPoint> readHighSymmetryPoints(Path file) {
        List<HighSymmetryPoint> points = new ArrayList<>();
        for (CSVRecord r : readRecords(file)) {
            points.add(new HighSymmetryPoint(value(r, "label").trim(),
                    new double[] {parseDouble(value(r, "kx"), HIGH_SYMMETRY_FILE),
                            parseDouble(value(r, "ky"), HIGH_SYMMETRY_FILE),
                            parseDouble(value(r, "kz"), HIGH_SYMMETRY_FILE)}));
        }
        return points;
    }

    /**
     * ヘッダ付き CSV を全行読み込みます。
     *
     * @param file ファイルです
     * @return レコードです
     * @throws DataIntegrityException ファイルが存在しない、または読み込みに失敗した場合に発生します
     */
    private static List<CSVRecord> readRecords(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new DataIntegrityException("必須ファイルが見つかりません: " + file);
        }
        CSVFormat format = CSVFormat.Builder.create(CSVFormat.DEFAULT).setHeader()
                .setSkipHeaderRecord(true).setIgnoreSurroundingSpaces(true).build();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
                CSVParser parser = format.parse(reader)) {
            return parser.getRecords();
        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            throw new DataIntegrityException("CSV の読み込みに失敗しました: " + file, e);
        }
    }

    private static String value(CSVRecord r, String column) {
        if (!r.isMapped(column) || !r.isSet(column)) {
            throw new DataIntegrityException(
                    "列 " + column + " がありません: 行=" + r.getRecordNumber());
        }
        return r.get(column);
    }

    private static int index(CSVRecord r, String column, int bound) {
        int i = parseIndex(r, column);
        if (i >= bound) {
            throw new DataIntegrityException(column + " が範囲外です: " + i + "（上限 " + bound + "）、行="
                    + r.getRecordNumber());
        }
        return i;
    }

    private static int parseIndex(CSVRecord r, String column) {
        String raw = value(r, column);
        try {
            int i = Integer.parseInt(raw.trim());
            if (i < 0) {
                throw new DataIntegrityException(column + " に負の値があります: " + raw);
            }
            return i;
        } catch (NumberFormatException e) {
            throw new DataIntegrityException(column + " を整数として解釈できません: " + raw, e);
        }
    }

    private static double parseDouble(String raw, String context) {
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException | NullPointerException e) {
            throw new DataIntegrityException(context + " の数値を解釈できません: " + raw, e);
        }
    }

    private static int parseInt(Map<String, String> meta, String key, int defaultValue) {
        String raw = meta.get(key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new DataIntegrityException(key + " を整数として解釈できません: " + raw, e);
        }
    }

    private static boolean parseFlag(Map<String, String> meta, String key) {
        String raw = meta.get(key);
        if (raw == null) {
            return false;
        }
        String v = raw.replace(".", "").toLowerCase(Locale.ROOT);
        return "true".equals(v) || "t".equals(v) || "1".equals(v);
    }
}
