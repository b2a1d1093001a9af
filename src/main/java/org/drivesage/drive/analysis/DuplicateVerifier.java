package org.drivesage.drive.analysis;

import org.drivesage.drive.HashingUtils;
import org.drivesage.drive.IoErrors;
import org.drivesage.drive.dto.analysis.DuplicateRecord;
import org.drivesage.drive.dto.analysis.DuplicateVerification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 对疑似重复文件做 sha256 复核（可选的第二遍）。
 * <p>
 * 同一个 original 往往对应多个 duplicate，哈希结果按路径缓存，每个文件只读一次。
 */
public class DuplicateVerifier {

    private static final Logger log = LoggerFactory.getLogger(DuplicateVerifier.class);

    private final long maxBytes;

    public DuplicateVerifier(long maxBytes) {
        this.maxBytes = maxBytes;
    }

    public DuplicateVerification verify(List<DuplicateRecord> candidates) {
        List<DuplicateRecord> confirmed = new ArrayList<>();
        List<DuplicateRecord> mismatched = new ArrayList<>();
        List<DuplicateRecord> unverified = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Map<String, String> hashes = new HashMap<>();

        for (DuplicateRecord candidate : candidates) {
            if (candidate.size() > maxBytes) {
                unverified.add(candidate);
                warnings.add("文件超过复核大小上限（" + maxBytes + " 字节），未复核：" + candidate.duplicate());
                continue;
            }
            try {
                String originalHash = hash(candidate.original(), hashes);
                String duplicateHash = hash(candidate.duplicate(), hashes);
                if (originalHash.equals(duplicateHash)) {
                    confirmed.add(candidate);
                } else {
                    mismatched.add(candidate);
                }
            } catch (IOException e) {
                unverified.add(candidate);
                warnings.add("复核失败：" + candidate.duplicate() + "（" + IoErrors.describe(e) + "）");
            }
        }

        log.info("重复文件复核完成：内容一致 {}，内容不同 {}，未复核 {}", confirmed.size(), mismatched.size(), unverified.size());
        return new DuplicateVerification(confirmed, mismatched, unverified, warnings);
    }

    private static String hash(String path, Map<String, String> cache) throws IOException {
        String cached = cache.get(path);
        if (cached != null) {
            return cached;
        }
        Path file = Path.of(path);
        if (!Files.isRegularFile(file, LinkOption.NOFOLLOW_LINKS)) {
            throw new IOException("不是普通文件或已不存在：" + path);
        }
        String value = HashingUtils.sha256Hex(file);
        cache.put(path, value);
        return value;
    }
}
