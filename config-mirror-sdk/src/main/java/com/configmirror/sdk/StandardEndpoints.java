package com.configmirror.sdk;

abstract class StandardEndpoints {
    private StandardEndpoints() {}

    static final String CONFIG_SPECS_PATH = "/download_config_specs";
    static final String ID_LISTS_PATH = "/get_id_lists";
}
