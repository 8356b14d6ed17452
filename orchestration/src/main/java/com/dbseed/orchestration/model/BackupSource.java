package com.dbseed.orchestration.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

import java.net.URI;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackupSource {
    private String sourceUrl;
    private String accountIdentifier;
    private String shareName;
    private String relativePath;
    @ToString.Exclude
    private String signingKey;

    /**
     * Parses file share URL of form {@code https://<account>.file.core.windows.net/<share>/<path>}.
     *
     * @param sourceUrl  URL of the file
     * @param signingKey optional account key
     * @return parsed source
     * @throws IllegalArgumentException if URL does not contain account, share and file path
     */
    public static BackupSource fromUrl(String sourceUrl, String signingKey) {
        URI uri = URI.create(sourceUrl);
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("Backup source URL has no host: " + sourceUrl);
        }

        String accountIdentifier = StringUtils.substringBefore(uri.getHost(), ".");
        String path = StringUtils.removeStart(uri.getRawPath(), "/");
        String shareName = StringUtils.substringBefore(path, "/");
        String relativePath = StringUtils.substringAfter(path, "/");

        if (StringUtils.isAnyEmpty(accountIdentifier, shareName, relativePath)) {
            throw new IllegalArgumentException("Backup source URL must contain share name and file path: " + sourceUrl);
        }

        return BackupSource.builder()
                .sourceUrl(sourceUrl)
                .accountIdentifier(accountIdentifier)
                .shareName(shareName)
                .relativePath(relativePath)
                .signingKey(signingKey)
                .build();
    }

    public String getCanonicalizedResource() {
        return "/" + accountIdentifier + "/" + shareName + "/" + relativePath;
    }
}
