package com.chih.JQWeb.core.compiler;

import com.chih.JQWeb.core.compiler.instruction.Instruction;
import com.chih.JQWeb.core.compiler.instruction.TextInstruction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;

/**
 * 编译期的静态文本缓冲
 * <p>
 * 相邻的静态片段先累积，遇到动态指令前再合并成一条 {@link TextInstruction}。
 *
 * @author lizhiyuan
 * @since 2026/10/05
 */
public final class TextAccumulator {

    private final List<String> chunks = new ArrayList<>();

    public void append(String text) {
        chunks.add(text);
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }

    /**
     * 去掉最后一段末尾的"换行 + 缩进"
     *
     * @return 被去掉的部分，没有时为空串
     */
    public String rstrip() {
        if (chunks.isEmpty()) {
            return "";
        }
        int last = chunks.size() - 1;
        Matcher matcher = QWebSyntax.RSTRIP.matcher(chunks.get(last));
        if (!matcher.find()) {
            return "";
        }
        String strip = matcher.group();
        chunks.set(last, chunks.get(last).substring(0, matcher.start()));
        return strip;
    }

    public List<Instruction> flush() {
        return flush(false);
    }

    /**
     * 输出并清空缓冲
     *
     * @return 缓冲为空时返回空列表
     */
    public List<Instruction> flush(boolean rstrip) {
        if (chunks.isEmpty()) {
            return new ArrayList<>();
        }
        if (rstrip) {
            rstrip();
        }
        String text = String.join("", chunks);
        chunks.clear();
        if (text.isEmpty()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Collections.singletonList(new TextInstruction(text)));
    }
}
