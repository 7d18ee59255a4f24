/**
 * LineFramer.java
 *
 * 增量式分帧器：把任意切分的字符流还原为以换行符分隔的独立消息。
 * 每个桥接会话持有一个实例，只由读取该会话进程 stdout 的线程访问，因此不是线程安全的。
 */
package club.ppmc.bridge.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class LineFramer {

    private static final String DELIMITER = "\n";

    private final StringBuilder buffer = new StringBuilder();

    /**
     * 追加一段数据，并按顺序返回由它补全的所有消息。
     *
     * <p><b>设计思路</b>:
     * 1. 完整的行会被 trim，trim 后为空的行直接丢弃。
     * 2. 最后一个换行符之后的内容作为残留保存在缓冲区中，等待后续数据补全。
     * 3. 残留部分已知不含换行符，因此每次只从新追加的位置开始查找，
     *    一条很长的行被拆成许多小块送入时，总开销仍与其长度成线性关系。
     * </p>
     *
     * @param chunk 数据流的下一段，长度任意。
     * @return 已完成的消息，可能为空。
     */
    public List<String> feed(CharSequence chunk) {
        if (chunk == null || chunk.length() == 0) {
            return Collections.emptyList();
        }
        int scanFrom = buffer.length();
        buffer.append(chunk);

        int end = buffer.indexOf(DELIMITER, scanFrom);
        if (end < 0) {
            return Collections.emptyList();
        }

        List<String> messages = new ArrayList<>();
        int start = 0;
        while (end >= 0) {
            String line = buffer.substring(start, end).trim();
            if (!line.isEmpty()) {
                messages.add(line);
            }
            start = end + 1;
            end = buffer.indexOf(DELIMITER, start);
        }
        buffer.delete(0, start);
        return messages;
    }

    public String residual() {
        return buffer.toString();
    }

    public boolean hasResidual() {
        return buffer.length() > 0;
    }

    public void clear() {
        buffer.setLength(0);
    }
}
