package com.driftwatch.core.stage;

/**
 * Parameter keys passed to stages. External commands receive them as
 * {@code --<key> <value>} pairs.
 */
public final class StageParams {

    private StageParams() {}

    public static final String INPUT_PATH = "input_path";
    public static final String OUT_FILE = "out_file";
    public static final String RECORD_FILE = "record_file";
    public static final String DB_FILE = "db_file";
    public static final String DATA_FILE = "data_file";
    public static final String MODEL_PATH = "model_path";
    public static final String MODEL_FILE = "model_file";
    public static final String DATA_TEST_FILE = "data_test_file";
    public static final String TEST_DATA_FILE = "test_data_file";
    public static final String DEPLOY_PATH = "deploy_path";
}
