package com.example.microscopy.decode;

import java.nio.file.Path;
import java.util.List;

public interface DatasetDecoder {

    /**
     * 把一个显微镜数据文件解码成一个或多个数据集（图像栈等情况会有多个）。
     *
     * @throws DatasetDecodeException 解码失败
     */
    List<DecodedDataset> decode(Path file);
}
