package org.muma.redis.cli.docs;

import java.util.Optional;

/**
 * 命令文档查询
 * 实现必须是非阻塞的，并且不能使用交互请求所在的连接。
 */
public interface CommandDocs {

    Optional<CommandDoc> lookup(String commandName);
}
