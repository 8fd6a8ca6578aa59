package com.example.operatorrelay.model;

import java.io.Serializable;

/**
 * 媒体附件（图片等），内容以URL引用，服务端不做存储
 */
public class MediaAttachment implements Serializable {

    private static final long serialVersionUID = 1L;

    private String url;

    private String mimeType;

    private String fileName;

    public MediaAttachment() {
    }

    public MediaAttachment(String url, String mimeType, String fileName) {
        this.url = url;
        this.mimeType = mimeType;
        this.fileName = fileName;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getMimeType() {
        return mimeType;
    }

    public void setMimeType(String mimeType) {
        this.mimeType = mimeType;
    }

    public String getFileName() {
        return fileName;
    }

    public void setFileName(String fileName) {
        this.fileName = fileName;
    }

    @Override
    public String toString() {
        return "MediaAttachment{" +
                "url='" + url + '\'' +
                ", mimeType='" + mimeType + '\'' +
                ", fileName='" + fileName + '\'' +
                '}';
    }
}
