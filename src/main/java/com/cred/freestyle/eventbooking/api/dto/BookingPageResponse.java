package com.cred.freestyle.eventbooking.api.dto;

import com.cred.freestyle.eventbooking.domain.model.Booking;
import org.springframework.data.domain.Page;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A page of the caller's bookings with 1-based pagination metadata.
 *
 * @author Event Booking Team
 */
public class BookingPageResponse {

    private List<BookingResponse> bookings;
    private Pagination pagination;

    public BookingPageResponse() {
    }

    public static BookingPageResponse from(Page<Booking> page, Instant now) {
        BookingPageResponse response = new BookingPageResponse();
        response.setBookings(page.getContent().stream()
                .map(booking -> BookingResponse.fromEntity(booking, now))
                .collect(Collectors.toList()));

        Pagination pagination = new Pagination();
        pagination.setPage(page.getNumber() + 1);
        pagination.setLimit(page.getSize());
        pagination.setTotalCount(page.getTotalElements());
        pagination.setTotalPages(page.getTotalPages());
        pagination.setHasNextPage(page.hasNext());
        pagination.setHasPrevPage(page.hasPrevious());
        response.setPagination(pagination);
        return response;
    }

    public List<BookingResponse> getBookings() {
        return bookings;
    }

    public void setBookings(List<BookingResponse> bookings) {
        this.bookings = bookings;
    }

    public Pagination getPagination() {
        return pagination;
    }

    public void setPagination(Pagination pagination) {
        this.pagination = pagination;
    }

    public static class Pagination {

        private int page;
        private int limit;
        private long totalCount;
        private int totalPages;
        private boolean hasNextPage;
        private boolean hasPrevPage;

        public int getPage() {
            return page;
        }

        public void setPage(int page) {
            this.page = page;
        }

        public int getLimit() {
            return limit;
        }

        public void setLimit(int limit) {
            this.limit = limit;
        }

        public long getTotalCount() {
            return totalCount;
        }

        public void setTotalCount(long totalCount) {
            this.totalCount = totalCount;
        }

        public int getTotalPages() {
            return totalPages;
        }

        public void setTotalPages(int totalPages) {
            this.totalPages = totalPages;
        }

        public boolean isHasNextPage() {
            return hasNextPage;
        }

        public void setHasNextPage(boolean hasNextPage) {
            this.hasNextPage = hasNextPage;
        }

        public boolean isHasPrevPage() {
            return hasPrevPage;
        }

        public void setHasPrevPage(boolean hasPrevPage) {
            this.hasPrevPage = hasPrevPage;
        }
    }
}
