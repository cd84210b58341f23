package io.sqlrpc.adapter;

import io.sqlrpc.model.ResultTable;

import java.util.List;

public interface SqlAdapter extends AutoCloseable {

    ResultTable execute(String sql, String nodeName, boolean fetch) throws DatabaseException;

    void dropRelation(String relation) throws DatabaseException;

    void loadTable(String relation, List<String> columns, List<String> columnTypes, List<List<Object>> rows)
            throws DatabaseException;

    @Override
    void close();
}
