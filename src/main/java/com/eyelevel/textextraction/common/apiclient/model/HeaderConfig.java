package com.eyelevel.textextraction.common.apiclient.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Static headers sent with every request of one client. Each client registers its own subclass as a
 * bean.
 */
@Getter
@Setter
public abstract class HeaderConfig {

    private List<Header> headers = new ArrayList<>();

    public HeaderConfig addHeader(String name, String value) {
        Header header = new Header();
        header.setName(name);
        header.setValue(value);
        headers.add(header);
        return this;
    }

    @Getter
    @Setter
    public static class Header {

        private String name;
        private String value;
    }
}
