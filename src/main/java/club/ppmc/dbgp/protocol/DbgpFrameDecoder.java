/**
 * DbgpFrameDecoder.java
 *
 * 将引擎发来的原始字节流切分为消息帧。
 * 引擎的每个消息形如 "长度\0XML\0"：纯数字的帧是长度头，直接丢弃（不用于校验边界）；
 * 其余帧按是否包含 init 标记分类。只有出现 NUL 结束符时才产出帧，不完整的数据保留在缓冲区等待下一次读取。
 * 帧在完整之后才按 UTF-8 解码，因此跨读取拆分的多字节字符也能正确还原。
 *
 * 该类不是线程安全的，每个连接的读取线程持有自己的实例。
 */
package club.ppmc.dbgp.protocol;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class DbgpFrameDecoder {

    private static final String INIT_MARKER = "<init ";

    private byte[] buffer = new byte[8192];
    private int length;

    public List<DbgpFrame> feed(byte[] data) {
        return feed(data, 0, data.length);
    }

    /**
     * 追加一段数据并返回其中所有已完整的帧。
     *
     * @param data 数据源。
     * @param offset 起始偏移。
     * @param count 字节数。
     * @return 按到达顺序排列的完整帧，没有完整帧时为空列表。
     */
    public List<DbgpFrame> feed(byte[] data, int offset, int count) {
        ensureCapacity(length + count);
        int scanFrom = length;
        System.arraycopy(data, offset, buffer, length, count);
        length += count;

        List<DbgpFrame> frames = new ArrayList<>();
        int frameStart = 0;
        for (int i = scanFrom; i < length; i++) {
            if (buffer[i] != 0) {
                continue;
            }
            String message = new String(buffer, frameStart, i - frameStart, StandardCharsets.UTF_8);
            frameStart = i + 1;
            DbgpFrame frame = classify(message);
            if (frame != null) {
                frames.add(frame);
            }
        }
        if (frameStart > 0) {
            System.arraycopy(buffer, frameStart, buffer, 0, length - frameStart);
            length -= frameStart;
        }
        return frames;
    }

    /** 缓冲区中尚未构成完整帧的字节数。 */
    public int pendingBytes() {
        return length;
    }

    private DbgpFrame classify(String message) {
        if (message.isBlank() || isLengthHeader(message)) {
            return null;
        }
        if (message.contains(INIT_MARKER)) {
            return new DbgpFrame(DbgpFrame.Kind.INIT, message);
        }
        return new DbgpFrame(DbgpFrame.Kind.MESSAGE, message);
    }

    private static boolean isLengthHeader(String message) {
        for (int i = 0; i < message.length(); i++) {
            char c = message.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    private void ensureCapacity(int required) {
        if (required > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(required, buffer.length * 2));
        }
    }
}
