package com.chih.JQWeb.core.compiler;

import com.chih.JQWeb.core.compiler.instruction.Instruction;
import com.chih.JQWeb.core.xml.XmlElement;

import java.util.List;

/**
 * 单个指令的编译器
 * <p>
 * 处理完后需要从元素上移除自己消费的属性；包裹型指令通过
 * {@link CompileContext#compileDirectives(XmlElement, DirectiveCursor)} 编译其余指令作为主体。
 *
 * @author lizhiyuan
 * @since 2026/10/05
 */
@FunctionalInterface
public interface DirectiveHandler {

    List<Instruction> compile(XmlElement element, DirectiveCursor cursor, CompileContext context);
}
