package io.omnivector.jobbergate.agent.model;

import java.util.ArrayList;
import java.util.List;

/** One page of a paginated API listing. */
public class ListResponseEnvelope<T> 
{
    private List<T> items = new ArrayList<T>();
    private int     total;
    private int     page;
    private int     size;
    private int     pages;
    
    // Constructors.
    public ListResponseEnvelope() {}
    
    // Accessors
    public List<T> getItems() {
        return items;
    }
    public void setItems(List<T> items) {
        this.items = items;
    }
    public int getTotal() {
        return total;
    }
    public void setTotal(int total) {
        this.total = total;
    }
    public int getPage() {
        return page;
    }
    public void setPage(int page) {
        this.page = page;
    }
    public int getSize() {
        return size;
    }
    public void setSize(int size) {
        this.size = size;
    }
    public int getPages() {
        return pages;
    }
    public void setPages(int pages) {
        this.pages = pages;
    }
}
