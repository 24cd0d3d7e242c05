package io.github.yok.band.app;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.band.core.dataset.DatasetRequest;
import io.github.yok.band.core.dataset.SocAxis;
import io.github.yok.band.core.dataset.Spin;
import io.github.yok.band.core.error.ConfigurationException;
import io.github.yok.band.core.plot.PlotOptions;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.validation.Validation;
import javax.validation.Validator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

class BandPropertiesTest {

    private static BandProperties bind(Map<String, String> values) {
        Binder binder = new Binder(new MapConfigurationPropertySource(values));
        return binder.bind("band", BandProperties.class).get();
    }

    @Nested
    @DisplayName("バインド")
    class Binding {

        @Test
        @DisplayName("ケバブケースのキーと一覧を読み込む")
        void bindsKebabCase() {
            Map<String, String> values = new HashMap<>();
            values.put("band.folder", "/data/InAs");
            values.put("band.spin", "down");
            values.put("band.soc-axis", "z");
            values.put("band.custom-kpath[0]", "2");
            values.put("band.custom-kpath[1]", "-1");
            values.put("band.energy-window[0]", "-2");
            values.put("band.energy-window[1]", "3");
            values.put("band.view.kind", "element-spd");
            values.put("band.view.element-spd[0]", "As:spd");

            BandProperties p = bind(values);

            assertEquals("/data/InAs", p.getFolder());
            assertEquals(Spin.DOWN, p.getSpin());
            assertEquals(SocAxis.Z, p.getSocAxis());
            assertEquals(List.of(2, -1), p.getCustomKpath());
            assertEquals(PlotViewFactory.ViewKind.ELEMENT_SPD, p.getView().getKind());
            assertEquals(List.of("As:spd"), p.getView().getElementSpd());
            assertTrue(p.isInterpolate());
        }

        @Test
        @DisplayName("制約違反を検出する")
        void validation() {
            BandProperties p = new BandProperties();
            p.setStretchFactor(0.0);
            p.setNewN(1);
            p.setEnergyWindow(List.of(1.0));

            Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

            // folder、stretchFactor、newN、energyWindow
            assertEquals(4, validator.validate(p).size());
        }
    }

    @Nested
    @DisplayName("読み込み条件")
    class Request {

        @Test
        @DisplayName("展開しない場合はフォルダとスピンだけを渡す")
        void plain() {
            BandProperties p = new BandProperties();
            p.setFolder("bands");
            p.setEfermiFolder(" ");
            p.setStretchFactor(1.5);

            DatasetRequest r = p.toDatasetRequest();

            assertEquals(Paths.get("bands"), r.getFolder());
            assertNull(r.getEfermiFolder());
            assertEquals(Paths.get("bands"), r.resolveEfermiFolder());
            assertEquals(1.5, r.getStretchFactor(), 0.0);
            assertFalse(r.isUnfold());
        }

        @Test
        @DisplayName("展開する場合は区間・高対称点・変換行列を解釈する")
        void unfold() {
            BandProperties p = new BandProperties();
            p.setFolder("bands");
            p.setUnfold(true);
            p.getUnfoldSettings().setKpath(List.of("G-X", "X-M"));
            p.getUnfoldSettings().setHighSymmetryPoints(List.of("0 0 0", "0.5 0 0", "0.5 0.5 0"));
            p.getUnfoldSettings().setTransform(List.of("2 0 0", "0 2 0", "0 0 2"));

            DatasetRequest r = p.toDatasetRequest();

            assertEquals(List.of(List.of("G", "X"), List.of("X", "M")), r.getUnfoldLegs());
            assertArrayEquals(new double[] {0.5, 0.5, 0}, r.getHighSymmetryPoints().get(2), 0.0);
            assertEquals(2.0, r.getTransform()[1][1], 0.0);
            assertEquals(40, r.getPointsPerLeg());
        }

        @Test
        @DisplayName("変換行列が 3 行でなければ設定の誤り")
        void transformRows() {
            BandProperties p = new BandProperties();
            p.setFolder("bands");
            p.setUnfold(true);
            p.getUnfoldSettings().setKpath(List.of("G-X"));
            p.getUnfoldSettings().setHighSymmetryPoints(List.of("0 0 0", "0.5 0 0"));
            p.getUnfoldSettings().setTransform(List.of("2 0 0", "0 2 0"));

            assertThrows(ConfigurationException.class, p::toDatasetRequest);
        }

        @Test
        @DisplayName("区間ラベルとベクトルの書式を検査する")
        void malformed() {
            assertThrows(ConfigurationException.class,
                    () -> BandProperties.parseLegs(List.of("GX")));
            assertThrows(ConfigurationException.class, () -> BandProperties.parseLegs(List.of()));
            assertThrows(ConfigurationException.class,
                    () -> BandProperties.parseVectors(List.of("0 0"), "key"));
            assertThrows(ConfigurationException.class,
                    () -> BandProperties.parseVectors(List.of("0 a 0"), "key"));
        }
    }

    @Test
    @DisplayName("描画条件を組み立てる")
    void plotOptions() {
        BandProperties p = new BandProperties();
        p.setCustomKpath(List.of(1, -2));
        p.setEnergyWindow(List.of(-3.0, 2.0));
        p.setInterpolate(false);

        PlotOptions options = p.toPlotOptions();

        assertNotNull(options.getCustomPath());
        assertFalse(options.isInterpolate());
        assertEquals(-3.0, options.getEnergyMin(), 0.0);
        assertEquals(2.0, options.getEnergyMax(), 0.0);
        assertNull(new BandProperties().toPlotOptions().getCustomPath());
        assertThrows(ConfigurationException.class, () -> {
            BandProperties bad = new BandProperties();
            bad.setCustomKpath(List.of(0));
            bad.toPlotOptions();
        });
    }

    @Test
    @DisplayName("設定値をセクションごとに整形する")
    void multiline() {
        BandProperties p = new BandProperties();
        p.setFolder("bands");

        String text = p.toMultilineString();

        assertTrue(text.contains("  dataset:"));
        assertTrue(text.contains("    folder: bands"));
        assertTrue(text.contains("    kind: PLAIN"));
        assertTrue(p.toString().contains("band="));
    }
}
