package org.lupenghan.jsondb.storage.interfaces;

import java.nio.file.Path;

public interface PersistenceManager {
    /**
     * 从文件加载全部状态，文件不存在或无法解析时得到空数据库
     */
    void load();

    /**
     * 保存全部状态：先写临时文件，再原子替换目标文件
     * @param force 为 false 时距上次成功保存不足保存间隔则跳过写入并直接返回 true
     * @return 写入失败返回 false
     */
    boolean save(boolean force);

    // 是否有被节流跳过、尚未写入文件的修改
    boolean isDirty();

    void markDirty();

    /**
     * 复制数据文件到 target
     * @param flushPending 为 true 时先把未写入的修改强制保存
     */
    boolean backup(Path target, boolean flushPending);

    Path defaultBackupPath();

    // 用 source 覆盖数据文件并重新加载
    boolean restore(Path source);

    Path getPath();

    long fileSize();
}
