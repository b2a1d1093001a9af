package org.drivesage.drive;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;

/**
 * 把文件系统异常转换成可读的失败原因。
 * <p>
 * {@link FileSystemException#getMessage()} 往往只有路径本身，直接展示给调用方看不出失败原因。
 */
public final class IoErrors {

    private IoErrors() {
    }

    public static String describe(IOException e) {
        if (e instanceof NoSuchFileException ex) {
            return "路径不存在：" + ex.getFile();
        }
        if (e instanceof FileAlreadyExistsException ex) {
            return "目标已存在：" + ex.getFile();
        }
        if (e instanceof AccessDeniedException ex) {
            return "没有访问权限：" + ex.getFile();
        }
        if (e instanceof NotDirectoryException ex) {
            return "不是目录：" + ex.getFile();
        }
        if (e instanceof DirectoryNotEmptyException ex) {
            return "目录非空：" + ex.getFile();
        }
        if (e instanceof FileSystemException ex && ex.getReason() != null) {
            return ex.getReason() + "：" + ex.getFile();
        }
        String message = e.getMessage();
        return (message == null || message.isBlank()) ? e.getClass().getSimpleName() : message;
    }
}
