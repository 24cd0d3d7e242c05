package io.github.yok.band.core.structure;

import io.github.yok.band.core.error.ConfigurationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 軌道の s/p/d/f 区分です。
 */
public enum OrbitalGroup {

    S("s"), P("p"), D("d"), F("f");

    private final String label;

    OrbitalGroup(String label) {
        this.label = label;
    }

    /**
     * 凡例用のラベルを返します。
     *
     * @return ラベル（s, p, d, f）です
     */
    public String label() {
        return label;
    }

    /**
     * 1 文字の区分記号を変換します。
     *
     * @param symbol 区分記号です（大文字小文字は区別しません）
     * @return 区分です
     * @throws ConfigurationException 未知の記号の場合に発生します
     */
    public static OrbitalGroup fromSymbol(char symbol) {
        switch (Character.toLowerCase(symbol)) {
            case 's':
                return S;
            case 'p':
                return P;
            case 'd':
                return D;
            case 'f':
                return F;
            default:
                throw new ConfigurationException("未知の軌道区分です: " + symbol);
        }
    }

    /**
     * "spd" のような文字列を、記述順の区分リストに変換します。
     *
     * @param symbols 区分記号の並びです
     * @return 区分リストです
     * @throws ConfigurationException 空文字列、未知の記号、重複を含む場合に発生します
     */
    public static List<OrbitalGroup> parseAll(String symbols) {
        if (symbols == null || symbols.isBlank()) {
            throw new ConfigurationException("軌道区分の指定が空です");
        }
        List<OrbitalGroup> groups = new ArrayList<>();
        for (char c : symbols.trim().toCharArray()) {
            OrbitalGroup group = fromSymbol(c);
            if (groups.contains(group)) {
                throw new ConfigurationException(
                        "軌道区分が重複しています: " + symbols.toLowerCase(Locale.ROOT));
            }
            groups.add(group);
        }
        return groups;
    }
}
