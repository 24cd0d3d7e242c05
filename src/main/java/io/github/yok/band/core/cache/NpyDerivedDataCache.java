package io.github.yok.band.core.cache;

import com.google.common.base.Preconditions;
import io.github.yok.band.core.array.NdArray;
import io.github.yok.band.core.error.DataIntegrityException;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * NumPy の .npy 形式（version 1.0、float64、C 順）で派生配列を保存するキャッシュです。
 *
 * <p>
 * 書き込みは隣接する {@code .lock} ファイルの排他ロックを取得したうえで一時ファイルに書き出し、 アトミックに置き換えます。読み込み側が書きかけのファイルを見ることはありません。
 * </p>
 */
@Slf4j
public final class NpyDerivedDataCache implements DerivedDataCache {

    /**
     * マジックバイト {@code \x93NUMPY} です。
     */
    private static final byte[] MAGIC = {(byte) 0x93, 'N', 'U', 'M', 'P', 'Y'};

    /**
     * 読み込める要素数の上限です。
     */
    private static final long MAX_ELEMENTS = Integer.MAX_VALUE / Double.BYTES;

    private static final Pattern DESCR_PATTERN = Pattern.compile("'descr'\\s*:\\s*'([^']+)'");
    private static final Pattern FORTRAN_PATTERN =
            Pattern.compile("'fortran_order'\\s*:\\s*(True|False)");
    private static final Pattern SHAPE_PATTERN = Pattern.compile("'shape'\\s*:\\s*\\(([^)]*)\\)");

    /**
     * このプロセスで書き込み済みのキー（正規化したパス + 種類）です。
     */
    private final Set<String> written = new HashSet<>();

    @Override
    public Optional<NdArray> load(Path folder, DerivedKind kind) {
        Preconditions.checkNotNull(folder, "folder は null 不可です");
        Preconditions.checkNotNull(kind, "kind は null 不可です");

        Path file = folder.resolve(kind.fileName());
        if (!Files.isRegularFile(file)) {
            log.info("キャッシュがありません。kind={}、file={}", kind, file);
            return Optional.empty();
        }

        NdArray array;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            array = read(in, Files.size(file));
        } catch (IOException | IllegalArgumentException e) {
            throw new DataIntegrityException("キャッシュファイルが破損しています: " + file, e);
        }

        if (array.rank() != kind.rank()) {
            throw new DataIntegrityException("キャッシュの次元数が一致しません: " + file + "、期待=" + kind.rank()
                    + "、実際=" + Arrays.toString(array.shape()));
        }
        log.info("キャッシュを読み込みました。kind={}、shape={}", kind, Arrays.toString(array.shape()));
        return Optional.of(array);
    }

    @Override
    public void store(Path folder, DerivedKind kind, NdArray array) {
        Preconditions.checkNotNull(folder, "folder は null 不可です");
        Preconditions.checkNotNull(kind, "kind は null 不可です");
        Preconditions.checkNotNull(array, "array は null 不可です");
        Preconditions.checkArgument(array.rank() == kind.rank(), "%s の次元数は %s が必要です: %s", kind,
                kind.rank(), array);

        String key = folder.toAbsolutePath().normalize() + "#" + kind;
        synchronized (written) {
            if (!written.add(key)) {
                throw new IllegalStateException("同じキャッシュへの書き込みは 1 回までです: " + key);
            }
        }

        Path file = folder.resolve(kind.fileName());
        Path lockFile = folder.resolve(kind.fileName() + ".lock");
        try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE,
                StandardOpenOption.WRITE); FileLock lock = channel.lock()) {
            Path tmp = Files.createTempFile(folder, kind.fileName(), ".tmp");
            try {
                try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(tmp))) {
                    write(array, out);
                }
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new IllegalStateException("キャッシュの書き込みに失敗しました: " + file, e);
        }
        log.info("キャッシュを書き込みました。kind={}、shape={}、file={}", kind,
                Arrays.toString(array.shape()), file);
    }

    /**
     * .npy 形式の配列を読み込みます。
     *
     * <p>
     * ヘッダの shape から求めたデータ長がストリームの残りの長さと一致することを、配列を確保する前に確認します。
     * </p>
     *
     * @param in 入力ストリームです
     * @param length ストリーム全体のバイト数です
     * @return 配列です
     * @throws IOException 読み込みに失敗した場合、または形式が不正な場合に発生します
     */
    static NdArray read(InputStream in, long length) throws IOException {
        DataInputStream dis = new DataInputStream(in);

        byte[] magic = new byte[MAGIC.length];
        dis.readFully(magic);
        if (!Arrays.equals(magic, MAGIC)) {
            throw new IOException("NumPy のマジックナンバーではありません");
        }

        int major = dis.readUnsignedByte();
        dis.readUnsignedByte();

        // ヘッダ長はリトルエンディアン（v1 は 2 バイト、v2 以降は 4 バイト）
        int headerLen;
        if (major == 1) {
            headerLen = dis.readUnsignedByte() | (dis.readUnsignedByte() << 8);
        } else {
            headerLen = dis.readUnsignedByte() | (dis.readUnsignedByte() << 8)
                    | (dis.readUnsignedByte() << 16) | (dis.readUnsignedByte() << 24);
        }
        long remaining = length - MAGIC.length - 2 - (major == 1 ? 2 : 4);
        if (headerLen < 0 || headerLen > remaining) {
            throw new IOException("ヘッダ長がファイルの長さを超えています: " + headerLen);
        }
        remaining -= headerLen;
        byte[] headerBytes = new byte[headerLen];
        dis.readFully(headerBytes);
        String header = new String(headerBytes, StandardCharsets.US_ASCII).trim();

        String descr = group(DESCR_PATTERN, header, "descr");
        ByteOrder order;
        if ("<f8".equals(descr)) {
            order = ByteOrder.LITTLE_ENDIAN;
        } else if (">f8".equals(descr)) {
            order = ByteOrder.BIG_ENDIAN;
        } else {
            throw new IOException("float64 以外の dtype には対応していません: " + descr);
        }
        Matcher fortran = FORTRAN_PATTERN.matcher(header);
        if (fortran.find() && "True".equals(fortran.group(1))) {
            throw new IOException("Fortran 順の配列には対応していません");
        }
        int[] shape = parseShape(group(SHAPE_PATTERN, header, "shape"));

        long bodyLength = elementCount(shape) * Double.BYTES;
        if (bodyLength != remaining) {
            throw new IOException("配列データの長さが shape と一致しません: shape=" + Arrays.toString(shape)
                    + "、期待=" + bodyLength + " バイト、実際=" + remaining + " バイト");
        }

        NdArray array = NdArray.zeros(shape);
        byte[] body = new byte[(int) bodyLength];
        dis.readFully(body);
        if (dis.read() != -1) {
            throw new IOException("配列データの後ろに余分なバイトがあります");
        }
        ByteBuffer.wrap(body).order(order).asDoubleBuffer().get(array.rawData());
        return array;
    }

    /**
     * 配列を .npy 形式（version 1.0、リトルエンディアン float64）で書き込みます。
     *
     * @param array 配列です
     * @param out 出力ストリームです
     * @throws IOException 書き込みに失敗した場合に発生します
     */
    static void write(NdArray array, OutputStream out) throws IOException {
        DataOutputStream dos = new DataOutputStream(out);

        StringBuilder sb = new StringBuilder("{'descr': '<f8', 'fortran_order': False, 'shape': (");
        int[] shape = array.shape();
        for (int i = 0; i < shape.length; i++) {
            sb.append(shape[i]);
            if (i < shape.length - 1 || shape.length == 1) {
                sb.append(", ");
            }
        }
        sb.append("), }");
        String header = sb.toString();

        // magic(6) + version(2) + 長さ(2) + ヘッダ + 改行 を 64 バイト境界に揃える
        int baseLen = MAGIC.length + 2 + 2 + header.length() + 1;
        int padding = (64 - (baseLen % 64)) % 64;
        int totalHeaderLen = header.length() + padding + 1;

        dos.write(MAGIC);
        dos.writeByte(1);
        dos.writeByte(0);
        dos.writeByte(totalHeaderLen & 0xFF);
        dos.writeByte((totalHeaderLen >> 8) & 0xFF);
        dos.write(header.getBytes(StandardCharsets.US_ASCII));
        for (int i = 0; i < padding; i++) {
            dos.writeByte(' ');
        }
        dos.writeByte('\n');

        ByteBuffer buffer =
                ByteBuffer.allocate(array.size() * Double.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        buffer.asDoubleBuffer().put(array.rawData());
        dos.write(buffer.array());
        dos.flush();
    }

    private static String group(Pattern pattern, String header, String name) throws IOException {
        Matcher m = pattern.matcher(header);
        if (!m.find()) {
            throw new IOException("ヘッダに '" + name + "' がありません: " + header);
        }
        return m.group(1);
    }

    /**
     * shape の要素数を返します。1 つの byte 配列に収まらない要素数は拒否します。
     */
    private static long elementCount(int[] shape) throws IOException {
        long count = 1;
        try {
            for (int dim : shape) {
                if (dim < 0) {
                    throw new IOException("shape に負の長さがあります: " + Arrays.toString(shape));
                }
                count = Math.multiplyExact(count, dim);
            }
        } catch (ArithmeticException e) {
            throw new IOException("shape の要素数が大きすぎます: " + Arrays.toString(shape), e);
        }
        if (count > MAX_ELEMENTS) {
            throw new IOException("shape の要素数が大きすぎます: " + Arrays.toString(shape));
        }
        return count;
    }

    private static int[] parseShape(String raw) throws IOException {
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return new int[0];
        }
        String[] parts = trimmed.split("\\s*,\\s*");
        int count = 0;
        for (String part : parts) {
            if (!part.isEmpty()) {
                count++;
            }
        }
        int[] shape = new int[count];
        int next = 0;
        for (String part : parts) {
            if (!part.isEmpty()) {
                try {
                    shape[next++] = Integer.parseInt(part);
                } catch (NumberFormatException e) {
                    throw new IOException("shape を解釈できません: " + raw, e);
                }
            }
        }
        return shape;
    }
}
