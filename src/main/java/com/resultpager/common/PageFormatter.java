package com.resultpager.common;

import com.resultpager.session.PageView;

/**
 * 定义分页结果到字节输出的转换，便于不同客户端实现自定义格式。
 */
public interface PageFormatter {

    byte[] format(PageView view);
}
