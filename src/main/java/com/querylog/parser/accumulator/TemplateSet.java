package com.querylog.parser.accumulator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Templates of one user, kept ordered by descending count. Counts only grow by
 * one, so an incremented template moves left past the templates it now outnumbers
 * and equal counts keep their creation order.
 */
public class TemplateSet {

    private final List<Template> templates = new ArrayList<>();

    public Template add(String text) {
        Template template = new Template(text);
        templates.add(template);
        return template;
    }

    public Template increment(int index) {
        Template template = templates.get(index);
        template.increment();
        int i = index;
        while (i > 0 && templates.get(i - 1).getCount() < template.getCount()) {
            templates.set(i, templates.get(i - 1));
            i--;
        }
        templates.set(i, template);
        return template;
    }

    public Template get(int index) {
        return templates.get(index);
    }

    public int size() {
        return templates.size();
    }

    public boolean isEmpty() {
        return templates.isEmpty();
    }

    public List<Template> byDescendingCount() {
        return Collections.unmodifiableList(templates);
    }

    public long getTotalCount() {
        return templates.stream().mapToLong(Template::getCount).sum();
    }
}
