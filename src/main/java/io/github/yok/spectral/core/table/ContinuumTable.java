package io.github.yok.spectral.core.table;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 1 つの温度ブロックに含まれる、元素ごとの連続成分レコードです。
 *
 * <p>
 * 連続成分表のうち {@code rmJ == 0}（イオン分離していない元素合計）の行だけを保持します。 同じ元素の行が複数ある場合は先頭を採用します。
 * </p>
 */
public final class ContinuumTable {

    /**
     * 原子番号をキーとしたレコードです。
     */
    private final Map<Integer, ContinuumRecord> records;

    /**
     * 連続成分テーブルを生成します。
     *
     * @param records 原子番号をキーとしたレコードです
     */
    public ContinuumTable(Map<Integer, ContinuumRecord> records) {
        this.records = Map.copyOf(records);
    }

    /**
     * 連続成分表のブロックから読み込みます。
     *
     * @param block ブロックです（列 Z, rmJ, N_Cont, E_Cont, Continuum, N_Pseudo, E_Pseudo, Pseudo）
     * @return 連続成分テーブルです
     */
    public static ContinuumTable from(ColumnarBlock block) {
        int[] z = block.intColumn("Z");
        int[] rmJ = block.intColumn("rmJ");
        int[] nCont = block.intColumn("N_Cont");
        double[][] eCont = block.arrayColumn("E_Cont");
        double[][] cont = block.arrayColumn("Continuum");
        int[] nPseudo = block.intColumn("N_Pseudo");
        double[][] ePseudo = block.arrayColumn("E_Pseudo");
        double[][] pseudo = block.arrayColumn("Pseudo");

        Map<Integer, ContinuumRecord> records = new HashMap<>();
        for (int row = 0; row < z.length; row++) {
            if (rmJ[row] != 0 || records.containsKey(z[row])) {
                continue;
            }
            records.put(z[row], new ContinuumRecord(z[row],
                    ContinuumRecord.head(eCont[row], nCont[row]),
                    ContinuumRecord.head(cont[row], nCont[row]),
                    ContinuumRecord.head(ePseudo[row], nPseudo[row]),
                    ContinuumRecord.head(pseudo[row], nPseudo[row])));
        }
        return new ContinuumTable(records);
    }

    /**
     * 指定元素のレコードを返します。
     *
     * @param element 原子番号です
     * @return レコードです（存在しない場合は空）
     */
    public Optional<ContinuumRecord> find(int element) {
        return Optional.ofNullable(records.get(element));
    }
}
